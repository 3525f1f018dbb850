package com.example.ggstorecrawling.client;

import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

/**
 * Selenium WebDriver 기반 페이지 렌더러
 *
 * driver.get() 으로 접속하고 렌더링된 페이지 소스를 그대로 반환합니다.
 */
@Slf4j
public class SeleniumPageRenderer implements PageRenderer {

    private final WebDriver driver;

    public SeleniumPageRenderer(WebDriver driver) {
        this.driver = driver;
    }

    @Override
    public String render(String url) {
        try {
            driver.get(url);
            return driver.getPageSource();
        } catch (TimeoutException e) {
            throw new PageRenderTimeoutException("페이지 로딩 시간 초과: " + url, e);
        } catch (WebDriverException e) {
            throw new PageRenderException("페이지 접속 실패: " + url + " - " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            driver.quit();
            log.info("브라우저를 종료했습니다.");
        } catch (WebDriverException e) {
            log.warn("브라우저 종료 중 오류 발생: {}", e.getMessage());
        }
    }
}
