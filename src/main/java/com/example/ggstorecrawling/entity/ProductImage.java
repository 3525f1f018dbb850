package com.example.ggstorecrawling.entity;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * 다운로드된(또는 이미 디스크에 있던) 상품 이미지 한 장의 메타데이터
 *
 * 생성 후에는 변경되지 않습니다.
 */
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProductImage {

    /** 로컬 파일명 ({상품ID}_{순번 2자리}{확장자}) */
    private String filename;

    /** CDN 원본 URL (정규화된 형태) */
    private String originalUrl;

    /** 로컬 저장 경로 */
    private String localPath;

    /** 다운로드 시각 (이미 존재하던 파일이면 발견 시각) */
    private LocalDateTime downloadedAt;

    @Builder
    public ProductImage(String filename, String originalUrl, String localPath, LocalDateTime downloadedAt) {
        this.filename = filename;
        this.originalUrl = originalUrl;
        this.localPath = localPath;
        this.downloadedAt = downloadedAt;
    }
}
