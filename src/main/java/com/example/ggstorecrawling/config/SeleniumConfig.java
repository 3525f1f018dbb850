package com.example.ggstorecrawling.config;

import com.example.ggstorecrawling.client.PageRendererFactory;
import com.example.ggstorecrawling.client.SeleniumPageRenderer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.RemoteWebDriver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.MalformedURLException;
import java.net.URL;
import java.time.Duration;

/**
 * Selenium WebDriver 설정 클래스
 *
 * 크롤링 실행마다 Chrome 브라우저를 띄우는 {@link PageRendererFactory} 를 제공합니다.
 * - 로컬 환경: ChromeDriver 사용
 * - Docker 환경: RemoteWebDriver 사용 (Selenium Grid)
 *
 * User-Agent 는 설정값 하나로 고정합니다.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class SeleniumConfig {

    private final CrawlerProperties properties;

    /**
     * chromedriver 경로가 설정되어 있으면 시스템 프로퍼티에 등록합니다.
     * Remote 환경이거나 경로가 없으면 건너뜁니다 (Selenium Manager 가 드라이버를 찾음).
     */
    @PostConstruct
    void postConstruct() {
        CrawlerProperties.Browser browser = properties.getBrowser();
        if (!browser.isUseRemote() && browser.getDriverPath() != null && !browser.getDriverPath().isBlank()) {
            System.setProperty("webdriver.chrome.driver", browser.getDriverPath());
        }
    }

    /**
     * 실행마다 새 브라우저를 여는 렌더러 팩토리
     */
    @Bean
    public PageRendererFactory pageRendererFactory() {
        return headless -> new SeleniumPageRenderer(createWebDriver(headless));
    }

    private WebDriver createWebDriver(boolean headless) {
        ChromeOptions options = createChromeOptions(headless);
        CrawlerProperties.Browser browser = properties.getBrowser();

        WebDriver driver;
        if (browser.isUseRemote()) {
            try {
                driver = new RemoteWebDriver(new URL(browser.getHubUrl()), options);
            } catch (MalformedURLException e) {
                throw new IllegalStateException("Selenium Hub URL이 올바르지 않습니다: " + browser.getHubUrl(), e);
            }
        } else {
            driver = new ChromeDriver(options);
        }
        applyPageLoadTimeout(driver, Duration.ofSeconds(browser.getPageLoadTimeoutSeconds()));
        log.info("브라우저를 시작했습니다. (headless: {}, remote: {})", headless, browser.isUseRemote());
        return driver;
    }

    /**
     * 페이지 로딩 제한 시간 설정. 실패하면 이미 띄운 브라우저를 종료하고 예외를 다시 던집니다.
     */
    static void applyPageLoadTimeout(WebDriver driver, Duration timeout) {
        try {
            driver.manage().timeouts().pageLoadTimeout(timeout);
        } catch (RuntimeException e) {
            try {
                driver.quit();
            } catch (RuntimeException quitError) {
                e.addSuppressed(quitError);
            }
            throw e;
        }
    }

    /**
     * Chrome 브라우저 옵션 생성
     *
     * @param headless GUI 없이 실행할지 여부
     * @return 설정된 ChromeOptions
     */
    private ChromeOptions createChromeOptions(boolean headless) {
        ChromeOptions options = new ChromeOptions();
        if (headless) {
            options.addArguments("--headless=new");
        }
        options.addArguments("user-agent=" + properties.getUserAgent());

        // --- Docker 환경을 위한 안정성 옵션 ---
        options.addArguments("--disable-gpu");
        options.addArguments("--no-sandbox");
        options.addArguments("--disable-dev-shm-usage");
        options.addArguments("--disable-extensions");
        options.addArguments("--window-size=1920,1080");
        return options;
    }
}
