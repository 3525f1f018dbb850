package com.example.ggstorecrawling.client;

/**
 * 페이지 로딩 제한 시간 초과
 */
public class PageRenderTimeoutException extends PageRenderException {

    public PageRenderTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
