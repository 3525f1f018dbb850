package com.example.ggstorecrawling.client;

/**
 * 페이지 이동/렌더링 실패
 */
public class PageRenderException extends RuntimeException {

    public PageRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
