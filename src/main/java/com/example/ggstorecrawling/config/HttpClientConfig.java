package com.example.ggstorecrawling.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 이미지 다운로드용 HttpClient 설정
 *
 * 리다이렉트를 따라가고 연결 제한 시간을 둡니다.
 */
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final CrawlerProperties properties;

    @Bean
    public HttpClient imageHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getDownload().getTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
