package com.example.ggstorecrawling.service;

import com.example.ggstorecrawling.entity.ProductCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * GGStore 상품 페이지 HTML 파서
 *
 * 렌더링된 HTML 과 페이지 URL 로 상품 ID, 이름, 가격, 카테고리, 이미지 URL 을 추출합니다.
 * 어떤 항목을 찾지 못해도 예외를 던지지 않고 대체값(또는 빈 값)으로 처리합니다.
 *
 * 이름/가격은 순서가 정해진 매처 목록을 차례로 시도하고 처음으로 값이 나온 결과를 사용합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProductPageParser {

    /** 이름을 찾지 못했을 때의 대체값 */
    public static final String UNKNOWN_NAME = "Unknown Product";

    /** 상품 URL 경로에서 ID 앞에 오는 세그먼트: /products/{id} */
    private static final String PRODUCT_ROUTE = "products";

    private static final Pattern PRICE_TEXT = Pattern.compile("^\\$?(\\d[\\d,.]*)");
    private static final Pattern JSON_PRICE = Pattern.compile("\"price\":\\s*\"?\\$?(\\d[\\d,.]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern DATA_PRICE = Pattern.compile("^(\\d+)");
    private static final Pattern COLLECTION_PATH = Pattern.compile("/collections/([^/\"'?\\s]+)");
    private static final Pattern CDN_PRODUCT_SRC = Pattern.compile("cdn/shop/(?:files|products)/", Pattern.CASE_INSENSITIVE);
    private static final Pattern JSON_IMAGE_SRC = Pattern.compile("\"src\":\\s*\"([^\"]+)\"", Pattern.CASE_INSENSITIVE);

    /** 이름 추출 순서: og:title → title 태그 → 첫 번째 h1 */
    private static final List<Function<ParsedPage, Optional<String>>> NAME_MATCHERS = List.of(
            ProductPageParser::nameFromOgTitle,
            ProductPageParser::nameFromTitle,
            ProductPageParser::nameFromHeading
    );

    /** 가격 추출 순서: price 클래스 span 의 자체 텍스트 → JSON "price" 필드 → data-price 속성 */
    private static final List<Function<ParsedPage, Optional<String>>> PRICE_MATCHERS = List.of(
            ProductPageParser::priceFromStyledElement,
            ProductPageParser::priceFromStructuredData,
            ProductPageParser::priceFromDataAttribute
    );

    private final ImageUrlNormalizer normalizer;

    /**
     * 상품 페이지 파싱
     *
     * @param html 렌더링된 HTML (일부만 있거나 깨져 있어도 됨)
     * @param url 상품 페이지 URL
     * @return 추출 결과
     */
    public ProductCandidate parse(String html, String url) {
        String markup = html == null ? "" : html;
        ParsedPage page = new ParsedPage(Jsoup.parse(markup, url == null ? "" : url), markup);

        return ProductCandidate.builder()
                .id(extractProductId(url))
                .name(firstMatch(NAME_MATCHERS, page).orElse(UNKNOWN_NAME))
                .url(url)
                .price(firstMatch(PRICE_MATCHERS, page).map(value -> "$" + value).orElse(null))
                .category(extractCategory(markup).orElse(null))
                .imageUrls(extractImageUrls(page))
                .build();
    }

    /**
     * URL 에서 상품 ID 추출 (HTML 과 무관, URL 만으로 결정)
     *
     * /products/{id} 형식이면 {id}, 아니면 경로 전체를 '-' 로 이은 문자열을 사용합니다.
     * 쿼리 파라미터와 마지막 '/' 는 무시합니다.
     */
    public String extractProductId(String url) {
        String path = trimSlashes(pathOf(url));
        List<String> parts = Arrays.asList(path.split("/"));
        int routeIndex = parts.indexOf(PRODUCT_ROUTE);
        if (routeIndex >= 0 && routeIndex + 1 < parts.size() && !parts.get(routeIndex + 1).isEmpty()) {
            return parts.get(routeIndex + 1);
        }
        if (!path.isEmpty()) {
            return path.replace('/', '-');
        }
        String host = hostOf(url);
        return host.isEmpty() ? "product" : host.replace('.', '-');
    }

    /**
     * 상품 목록 페이지에서 상품 링크(a[href*=/products/])를 절대 URL 로 추출합니다.
     * 쿼리와 #fragment 는 떼어내고, 페이지 안의 중복은 제거합니다 (처음 나온 순서 유지).
     */
    public List<String> extractProductLinks(String html, String pageUrl) {
        Document document = Jsoup.parse(html == null ? "" : html, pageUrl == null ? "" : pageUrl);
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href*=\"/products/\"]")) {
            String href = anchor.absUrl("href");
            if (href.isEmpty()) {
                href = anchor.attr("href");
            }
            href = withoutQuery(href);
            if (!href.isEmpty() && href.contains("/products/")) {
                links.add(href);
            }
        }
        return List.copyOf(links);
    }

    Optional<String> extractCategory(String markup) {
        Matcher matcher = COLLECTION_PATH.matcher(markup);
        if (matcher.find()) {
            String slug = matcher.group(1);
            if (!slug.equalsIgnoreCase("all")) {
                return Optional.of(slug.toUpperCase(Locale.ROOT).replace('-', ' '));
            }
        }
        return Optional.empty();
    }

    /**
     * 네 가지 패턴으로 이미지 URL 을 모읍니다.
     * 1) srcset 후보 목록  2) CDN 상품 경로를 가리키는 src  3) data-src (지연 로딩)  4) JSON 의 "src" 필드
     * 정규화된 URL 기준으로 중복을 없애고, 처음 발견된 순서를 유지합니다.
     */
    private List<String> extractImageUrls(ParsedPage page) {
        Set<String> imageUrls = new LinkedHashSet<>();

        for (Element element : page.document.select("[srcset], [data-srcset]")) {
            String srcset = element.hasAttr("srcset") ? element.attr("srcset") : element.attr("data-srcset");
            for (String candidate : srcset.split(",")) {
                String trimmed = candidate.trim();
                if (!trimmed.isEmpty()) {
                    admit(trimmed.split("\\s+")[0], imageUrls);
                }
            }
        }

        for (Element element : page.document.select("[src]")) {
            String src = element.attr("src");
            if (CDN_PRODUCT_SRC.matcher(src).find()) {
                admit(src, imageUrls);
            }
        }

        for (Element element : page.document.select("[data-src]")) {
            admit(element.attr("data-src"), imageUrls);
        }

        Matcher json = JSON_IMAGE_SRC.matcher(page.html);
        while (json.find()) {
            admit(json.group(1).replace("\\/", "/"), imageUrls);
        }

        log.debug("이미지 {}개 발견", imageUrls.size());
        return List.copyOf(imageUrls);
    }

    private void admit(String url, Set<String> imageUrls) {
        if (normalizer.isProductImage(url)) {
            imageUrls.add(normalizer.canonicalize(url));
        }
    }

    private static Optional<String> firstMatch(List<Function<ParsedPage, Optional<String>>> matchers, ParsedPage page) {
        for (Function<ParsedPage, Optional<String>> matcher : matchers) {
            Optional<String> result = matcher.apply(page);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    // ===== 이름 매처 =====

    static Optional<String> nameFromOgTitle(ParsedPage page) {
        Element meta = page.document.selectFirst("meta[property=og:title]");
        return meta == null ? Optional.empty() : nonBlank(meta.attr("content"));
    }

    /** title 태그에서 사이트명 접미사 ('|' 또는 '–' 뒤) 를 잘라냅니다 */
    static Optional<String> nameFromTitle(ParsedPage page) {
        Element titleElement = page.document.selectFirst("title");
        if (titleElement == null) {
            return Optional.empty();
        }
        String title = titleElement.text().trim();
        if (title.contains("|")) {
            title = title.substring(0, title.indexOf('|')).trim();
        }
        if (title.contains("–")) {
            title = title.substring(0, title.indexOf('–')).trim();
        }
        return nonBlank(title);
    }

    static Optional<String> nameFromHeading(ParsedPage page) {
        Element heading = page.document.selectFirst("h1");
        return heading == null ? Optional.empty() : nonBlank(heading.text());
    }

    // ===== 가격 매처 =====

    static Optional<String> priceFromStyledElement(ParsedPage page) {
        for (Element span : page.document.select("span[class*=price]")) {
            Matcher matcher = PRICE_TEXT.matcher(span.ownText().trim());
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }

    static Optional<String> priceFromStructuredData(ParsedPage page) {
        Matcher matcher = JSON_PRICE.matcher(page.html);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    static Optional<String> priceFromDataAttribute(ParsedPage page) {
        for (Element element : page.document.select("[data-price]")) {
            Matcher matcher = DATA_PRICE.matcher(element.attr("data-price").trim());
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }

    // ===== URL 유틸 =====

    private static Optional<String> nonBlank(String value) {
        if (value == null || value.trim().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    private static String withoutQuery(String value) {
        int end = value.length();
        int query = value.indexOf('?');
        if (query >= 0) end = Math.min(end, query);
        int fragment = value.indexOf('#');
        if (fragment >= 0) end = Math.min(end, fragment);
        return value.substring(0, end);
    }

    private static String pathOf(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        try {
            String path = URI.create(trimmed).getRawPath();
            return path == null ? "" : path;
        } catch (IllegalArgumentException e) {
            // 공백 등 URI 로 해석할 수 없는 입력: scheme://host 부분만 떼어냄
            String rest = withoutQuery(trimmed);
            int schemeEnd = rest.indexOf("://");
            if (schemeEnd < 0 && !rest.startsWith("//")) {
                return rest;
            }
            rest = rest.substring(schemeEnd >= 0 ? schemeEnd + 3 : 2);
            int slash = rest.indexOf('/');
            return slash >= 0 ? rest.substring(slash) : "";
        }
    }

    private static String hostOf(String url) {
        if (url == null) {
            return "";
        }
        try {
            String host = URI.create(url.trim()).getHost();
            return host == null ? "" : host;
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    private static String trimSlashes(String path) {
        int start = 0;
        int end = path.length();
        while (start < end && path.charAt(start) == '/') start++;
        while (end > start && path.charAt(end - 1) == '/') end--;
        return path.substring(start, end);
    }

    /** Jsoup 문서와 원본 HTML 을 함께 들고 다니는 파싱 컨텍스트 */
    static final class ParsedPage {
        private final Document document;
        private final String html;

        ParsedPage(Document document, String html) {
            this.document = document;
            this.html = html;
        }
    }
}
