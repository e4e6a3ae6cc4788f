package com.paxkun.tracker.service.browser;

import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Launches Chrome through Selenium with the options configured for the tracker.
 * <p>
 * Author: Pax
 */
@Slf4j
@Component
public class BrowserEngineFactory {

    private static final List<String> BASE_ARGUMENTS = List.of("--disable-gpu", "--no-sandbox", "--disable-dev-shm-usage");

    @Value("${tracker.browser.headless:true}")
    private boolean headless = true;

    @Value("${tracker.browser.user-agent:}")
    private String userAgent = "";

    /**
     * Starts a new browser. The caller owns the returned engine and must close it.
     */
    public BrowserEngine launch() {
        ChromeOptions options = new ChromeOptions();
        List<String> appliedArguments = new ArrayList<>();
        if (headless) {
            appliedArguments.add("--headless=new");
        }
        appliedArguments.addAll(BASE_ARGUMENTS);
        if (userAgent != null && !userAgent.isBlank()) {
            appliedArguments.add("--user-agent=" + userAgent);
        }
        options.addArguments(appliedArguments);
        log.debug("Launching Chrome with arguments: {}", appliedArguments);

        return new SeleniumBrowserEngine(new ChromeDriver(options));
    }
}
