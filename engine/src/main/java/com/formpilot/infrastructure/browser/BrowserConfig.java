package com.formpilot.infrastructure.browser;

import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * Chrome session the form surface drives. Attaches to a browser the user already started with
 * remote debugging enabled, so the user's own window and login state are reused. The driver is
 * not quit on shutdown because the browser belongs to the user.
 */
@Slf4j
@Configuration
public class BrowserConfig {

    @Value("${form-filler.browser.debugger-address:127.0.0.1:9222}")
    private String debuggerAddress;

    @Lazy
    @Bean(destroyMethod = "")
    public WebDriver webDriver() {
        ChromeOptions options = new ChromeOptions();
        options.setExperimentalOption("debuggerAddress", debuggerAddress);
        log.info("[Browser] Attaching to Chrome at {}", debuggerAddress);
        return new ChromeDriver(options);
    }
}
