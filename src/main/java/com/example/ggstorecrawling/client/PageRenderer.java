package com.example.ggstorecrawling.client;

/**
 * 페이지 렌더링 기능 (브라우저 자동화)
 *
 * URL 로 이동해서 렌더링이 끝난 HTML 을 돌려줍니다.
 */
public interface PageRenderer extends AutoCloseable {

    /**
     * @param url 이동할 URL
     * @return 렌더링된 HTML
     * @throws PageRenderException 이동/렌더링 실패 시 (제한 시간 초과는 {@link PageRenderTimeoutException})
     */
    String render(String url);

    @Override
    void close();
}
