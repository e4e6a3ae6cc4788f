package com.paxkun.tracker.service.browser;

import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WindowType;

/**
 * {@link BrowserEngine} backed by a single WebDriver session. Pages are opened as tabs
 * and are expected to be used one at a time.
 */
@Slf4j
public class SeleniumBrowserEngine implements BrowserEngine {

    private final WebDriver driver;
    private final String homeHandle;

    public SeleniumBrowserEngine(WebDriver driver) {
        this.driver = driver;
        this.homeHandle = driver.getWindowHandle();
    }

    @Override
    public BrowserPage newPage() {
        driver.switchTo().window(homeHandle);
        driver.switchTo().newWindow(WindowType.TAB);
        String handle = driver.getWindowHandle();
        log.debug("Opened browser tab {}", handle);
        return new SeleniumBrowserPage(driver, handle, homeHandle);
    }

    @Override
    public void close() {
        try {
            driver.quit();
            log.debug("Browser session closed");
        } catch (WebDriverException e) {
            log.warn("⚠️ Failed to quit browser cleanly: {}", e.getMessage());
        }
    }
}
