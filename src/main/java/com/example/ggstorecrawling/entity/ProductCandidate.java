package com.example.ggstorecrawling.entity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 상품 페이지 HTML 에서 추출한 1차 결과
 *
 * 같은 HTML/URL 을 넣으면 항상 같은 값이 나옵니다 (equals 비교 가능).
 */
@Value
@Builder
public class ProductCandidate {

    String id;
    String name;
    String url;
    String price;
    String category;

    /** 정규화된 이미지 URL (처음 발견된 순서, 중복 없음) */
    @Singular
    List<String> imageUrls;
}
