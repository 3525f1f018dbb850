package com.example.ggstorecrawling.client;

/**
 * 크롤링 실행마다 브라우저를 새로 띄우기 위한 팩토리
 */
@FunctionalInterface
public interface PageRendererFactory {

    PageRenderer open(boolean headless);
}
