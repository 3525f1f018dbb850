package com.example.ggstorecrawling.ledger;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 세션 진행 카운터
 */
@Getter
@Setter
@NoArgsConstructor
public class SessionProgress {

    /** 목록 페이지에서 발견한 상품 수 */
    private int productsDiscovered;
    /** 크롤링 완료한 상품 수 */
    private int productsCrawled;
    /** 이미 다운로드되어 건너뛴 상품 수 */
    private int productsSkipped;
    private int imagesDownloaded;
    private int imagesFailed;
    /** 현재 목록 페이지 번호 */
    private int currentPage = 1;
    /** 마지막으로 처리한 상품 URL */
    private String lastProductUrl;
}
