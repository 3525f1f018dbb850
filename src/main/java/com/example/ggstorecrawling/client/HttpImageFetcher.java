package com.example.ggstorecrawling.client;

import com.example.ggstorecrawling.config.CrawlerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * java.net.http.HttpClient 기반 이미지 다운로드
 *
 * 고정 User-Agent 를 사용하며 2xx 가 아닌 응답은 실패로 처리합니다.
 */
@Component
@RequiredArgsConstructor
public class HttpImageFetcher implements ImageFetcher {

    private final HttpClient imageHttpClient;
    private final CrawlerProperties properties;

    @Override
    public byte[] fetch(String url) throws IOException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(properties.getDownload().getTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", "image/avif,image/webp,image/*,*/*;q=0.8")
                .GET()
                .build();
        HttpResponse<byte[]> response;
        try {
            response = imageHttpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("이미지 다운로드가 중단되었습니다: " + url);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("HTTP " + status + " - " + url);
        }
        return response.body();
    }
}
