package com.example.ggstorecrawling.entity;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 한 번의 크롤링에서 만들어진 상품 정보
 *
 * 메타데이터 파일(metadata.json)에 저장되는 단위입니다.
 * 같은 상품을 다시 크롤링하면 기존 값을 고치지 않고 새 Product 를 만듭니다.
 */
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Product {

    /** 상품 ID (URL 경로에서 추출) */
    private String id;

    /** 상품명 */
    private String name;

    /** 상품 페이지 URL */
    private String url;

    /** 가격 (예: "$19.99"), 없을 수 있음 */
    private String price;

    /** 카테고리, 없을 수 있음 */
    private String category;

    /** 다운로드 성공한 이미지 목록 (URL 순서 유지) */
    private List<ProductImage> images = new ArrayList<>();

    /** 크롤링 시각 */
    private LocalDateTime crawledAt;

    @Builder
    public Product(String id, String name, String url, String price, String category,
                   List<ProductImage> images, LocalDateTime crawledAt) {
        this.id = id;
        this.name = name;
        this.url = url;
        this.price = price;
        this.category = category;
        this.images = images == null ? new ArrayList<>() : new ArrayList<>(images);
        this.crawledAt = crawledAt;
    }
}
