package com.example.ggstorecrawling.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("SeleniumConfig 테스트")
class SeleniumConfigTest {

    @Test
    @DisplayName("제한 시간 설정이 성공하면 브라우저는 그대로 둔다")
    void applyPageLoadTimeout_success() {
        WebDriver driver = mock(WebDriver.class, RETURNS_DEEP_STUBS);

        SeleniumConfig.applyPageLoadTimeout(driver, Duration.ofSeconds(60));

        verify(driver.manage().timeouts()).pageLoadTimeout(Duration.ofSeconds(60));
        verify(driver, never()).quit();
    }

    @Test
    @DisplayName("제한 시간 설정에 실패하면 브라우저를 종료하고 예외를 전달한다")
    void applyPageLoadTimeout_failureQuitsDriver() {
        WebDriver driver = mock(WebDriver.class);
        when(driver.manage()).thenThrow(new WebDriverException("session not created"));

        WebDriverException e = assertThrows(WebDriverException.class,
                () -> SeleniumConfig.applyPageLoadTimeout(driver, Duration.ofSeconds(60)));

        assertTrue(e.getMessage().contains("session not created"));
        verify(driver).quit();
    }

    @Test
    @DisplayName("종료도 실패하면 원래 예외에 suppressed 로 붙는다")
    void applyPageLoadTimeout_quitFailureIsSuppressed() {
        WebDriver driver = mock(WebDriver.class);
        when(driver.manage()).thenThrow(new WebDriverException("session not created"));
        doThrow(new WebDriverException("already closed")).when(driver).quit();

        WebDriverException e = assertThrows(WebDriverException.class,
                () -> SeleniumConfig.applyPageLoadTimeout(driver, Duration.ofSeconds(60)));

        assertEquals(1, e.getSuppressed().length);
    }
}
