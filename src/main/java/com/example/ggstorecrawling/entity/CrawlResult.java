package com.example.ggstorecrawling.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 크롤링 결과 전체 (메타데이터 파일의 루트)
 *
 * totalProducts / totalImages 는 별도로 저장된 값을 믿지 않고 항상 products 에서 다시 계산합니다.
 */
@NoArgsConstructor
public class CrawlResult {

    private List<Product> products = new ArrayList<>();

    @Getter
    private LocalDateTime crawledAt;

    public CrawlResult(LocalDateTime crawledAt) {
        this.crawledAt = crawledAt;
    }

    /**
     * 이전 실행의 결과를 이어받는 새 결과를 만듭니다.
     * 건너뛴 상품도 스냅샷에 남아 있어야 다음 실행에서 "이미 다운로드됨"으로 인식됩니다.
     *
     * @param previous 이전 결과 (없으면 null)
     * @param crawledAt 이번 실행 시각
     * @return 이전 상품 목록을 그대로 담은 새 결과
     */
    public static CrawlResult seededFrom(CrawlResult previous, LocalDateTime crawledAt) {
        CrawlResult result = new CrawlResult(crawledAt);
        if (previous != null) {
            result.products.addAll(previous.products);
        }
        return result;
    }

    /**
     * 상품 추가. 같은 ID 의 상품이 이미 있으면 그 자리에서 교체합니다.
     */
    public void addProduct(Product product) {
        for (int i = 0; i < products.size(); i++) {
            if (products.get(i).getId().equals(product.getId())) {
                products.set(i, product);
                return;
            }
        }
        products.add(product);
    }

    public boolean containsProduct(String productId) {
        return products.stream().anyMatch(p -> p.getId().equals(productId));
    }

    public List<Product> getProducts() {
        return Collections.unmodifiableList(products);
    }

    @JsonIgnore
    public Set<String> getProductIds() {
        return products.stream().map(Product::getId).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @JsonProperty(value = "total_products", access = JsonProperty.Access.READ_ONLY)
    public int getTotalProducts() {
        return products.size();
    }

    @JsonProperty(value = "total_images", access = JsonProperty.Access.READ_ONLY)
    public int getTotalImages() {
        return products.stream().mapToInt(p -> p.getImages().size()).sum();
    }
}
