package com.example.ggstorecrawling.service;

import com.example.ggstorecrawling.config.CrawlerProperties;
import org.jsoup.parser.Parser;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 이미지 URL 정규화 / 중복 제거
 *
 * Shopify CDN 은 width 등 쿼리 파라미터와 상관없이 같은 원본 이미지를 주기 때문에
 * 쿼리를 모두 제거하면 중복 제거와 "항상 원본 해상도" 를 한 번에 처리할 수 있습니다.
 */
@Component
public class ImageUrlNormalizer {

    /** 허용하는 이미지 확장자 */
    public static final List<String> IMAGE_EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".webp", ".gif");

    /** 상품 이미지가 올라가는 CDN 경로 */
    public static final String CDN_PATH = "cdn/shop/";

    private final String baseUrl;

    @Autowired
    public ImageUrlNormalizer(CrawlerProperties properties) {
        this(properties.getBaseUrl());
    }

    public ImageUrlNormalizer(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    /**
     * URL 하나를 정규 형태로 변환합니다.
     * 1) HTML 엔티티 디코딩 (&amp;amp; → &amp;)
     * 2) //host/... → https://host/..., 그 외 상대 경로는 사이트 기준 URL 로 변환
     * 3) 쿼리 파라미터 제거
     *
     * @param url 원본 URL
     * @return 정규화된 URL
     */
    public String canonicalize(String url) {
        String decoded = Parser.unescapeEntities(url.trim(), true);

        String absolute;
        if (decoded.startsWith("//")) {
            absolute = "https:" + decoded;
        } else if (!decoded.startsWith("http")) {
            absolute = resolveAgainstBase(decoded);
        } else {
            absolute = decoded;
        }
        return stripQuery(absolute);
    }

    /**
     * 정규화 후 처음 나온 순서를 유지하며 중복을 제거합니다.
     * 순서가 파일명 순번을 결정하므로 정렬하지 않습니다.
     */
    public List<String> deduplicate(Collection<String> urls) {
        Set<String> unique = new LinkedHashSet<>();
        for (String url : urls) {
            if (url != null && !url.isBlank()) {
                unique.add(canonicalize(url));
            }
        }
        return new ArrayList<>(unique);
    }

    /**
     * 상품 이미지 URL 인지 확인합니다.
     * CDN 경로를 포함해야 하고, 쿼리/fragment 를 뗀 경로가 이미지 확장자로 끝나야 합니다.
     * (a.jpg.json 처럼 확장자가 중간에만 있는 경로는 제외)
     */
    public boolean isProductImage(String url) {
        if (url == null || url.isEmpty()) {
            return false;
        }
        if (!url.contains(CDN_PATH)) {
            return false;
        }
        String path = pathOf(url).toLowerCase(Locale.ROOT);
        for (String ext : IMAGE_EXTENSIONS) {
            if (path.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    private String resolveAgainstBase(String relative) {
        try {
            return URI.create(baseUrl).resolve(relative).toString();
        } catch (IllegalArgumentException e) {
            // 공백 등 URI 로 해석할 수 없는 문자는 단순 결합
            String separator = relative.startsWith("/") ? "" : "/";
            return baseUrl + separator + relative;
        }
    }

    private static String stripQuery(String url) {
        int queryStart = url.indexOf('?');
        if (queryStart < 0) {
            return url;
        }
        int fragmentStart = url.indexOf('#');
        if (fragmentStart >= 0 && fragmentStart < queryStart) {
            return url;
        }
        String fragment = fragmentStart > queryStart ? url.substring(fragmentStart) : "";
        return url.substring(0, queryStart) + fragment;
    }

    private static String pathOf(String url) {
        int end = url.length();
        int query = url.indexOf('?');
        if (query >= 0) end = Math.min(end, query);
        int fragment = url.indexOf('#');
        if (fragment >= 0) end = Math.min(end, fragment);
        return url.substring(0, end);
    }
}
