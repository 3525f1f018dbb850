package com.example.ggstorecrawling.client;

import java.io.IOException;

/**
 * HTTP GET 으로 이미지 바이트를 가져오는 기능
 */
@FunctionalInterface
public interface ImageFetcher {

    /**
     * @param url 이미지 URL
     * @return 응답 본문
     * @throws IOException 전송 오류, 제한 시간 초과, 2xx 가 아닌 응답
     */
    byte[] fetch(String url) throws IOException;
}
