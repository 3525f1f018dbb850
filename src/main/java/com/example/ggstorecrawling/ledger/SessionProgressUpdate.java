package com.example.ggstorecrawling.ledger;

import lombok.Builder;
import lombok.Value;

/**
 * 세션 진행 상황 갱신 요청. null 이 아닌 필드만 반영됩니다.
 */
@Value
@Builder
public class SessionProgressUpdate {
    Integer productsDiscovered;
    Integer productsCrawled;
    Integer productsSkipped;
    Integer imagesDownloaded;
    Integer imagesFailed;
    Integer currentPage;
    String lastProductUrl;

    public void applyTo(SessionProgress progress) {
        if (productsDiscovered != null) progress.setProductsDiscovered(productsDiscovered);
        if (productsCrawled != null) progress.setProductsCrawled(productsCrawled);
        if (productsSkipped != null) progress.setProductsSkipped(productsSkipped);
        if (imagesDownloaded != null) progress.setImagesDownloaded(imagesDownloaded);
        if (imagesFailed != null) progress.setImagesFailed(imagesFailed);
        if (currentPage != null) progress.setCurrentPage(currentPage);
        if (lastProductUrl != null) progress.setLastProductUrl(lastProductUrl);
    }
}
