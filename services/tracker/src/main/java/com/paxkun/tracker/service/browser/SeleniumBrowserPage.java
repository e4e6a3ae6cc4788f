package com.paxkun.tracker.service.browser;

import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.By;
import org.openqa.selenium.ElementClickInterceptedException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.time.Duration;
import java.util.Optional;

/**
 * One browser tab. Every operation re-focuses the tab first since the driver is shared.
 */
@Slf4j
public class SeleniumBrowserPage implements BrowserPage {

    private final WebDriver driver;
    private final String handle;
    private final String homeHandle;

    SeleniumBrowserPage(WebDriver driver, String handle, String homeHandle) {
        this.driver = driver;
        this.handle = handle;
        this.homeHandle = homeHandle;
    }

    @Override
    public void navigate(String url, Duration timeout) {
        focus();
        try {
            driver.manage().timeouts().pageLoadTimeout(timeout);
            driver.get(url);
        } catch (TimeoutException e) {
            throw new NavigationException("Timeout loading " + url + " (timeout: " + timeout.toMillis() + "ms)", e);
        } catch (WebDriverException e) {
            throw new NavigationException("Error navigating to " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean waitForSelector(String cssSelector, Duration timeout) {
        focus();
        try {
            new WebDriverWait(driver, timeout)
                    .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(cssSelector)));
            return true;
        } catch (TimeoutException e) {
            log.debug("Selector '{}' did not appear within {}ms", cssSelector, timeout.toMillis());
            return false;
        }
    }

    @Override
    public boolean isVisible(String cssSelector) {
        return firstVisible(cssSelector).isPresent();
    }

    @Override
    public boolean click(String cssSelector) {
        Optional<WebElement> element = firstVisible(cssSelector);
        if (element.isEmpty()) {
            return false;
        }
        try {
            element.get().click();
        } catch (ElementClickInterceptedException e) {
            // overlays (cookie banners, ads) swallow native clicks
            ((JavascriptExecutor) driver).executeScript("arguments[0].click();", element.get());
        }
        return true;
    }

    @Override
    public String pageSource() {
        focus();
        return driver.getPageSource();
    }

    @Override
    public String currentUrl() {
        focus();
        return driver.getCurrentUrl();
    }

    @Override
    public void close() {
        try {
            focus();
            driver.close();
            driver.switchTo().window(homeHandle);
        } catch (WebDriverException e) {
            log.warn("⚠️ Failed to close browser tab {}: {}", handle, e.getMessage());
        }
    }

    private Optional<WebElement> firstVisible(String cssSelector) {
        focus();
        try {
            return driver.findElements(By.cssSelector(cssSelector)).stream()
                    .filter(WebElement::isDisplayed)
                    .findFirst();
        } catch (StaleElementReferenceException e) {
            return Optional.empty();
        }
    }

    private void focus() {
        if (!handle.equals(driver.getWindowHandle())) {
            driver.switchTo().window(handle);
        }
    }
}
