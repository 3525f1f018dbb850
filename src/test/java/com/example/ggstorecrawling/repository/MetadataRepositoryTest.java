package com.example.ggstorecrawling.repository;

import com.example.ggstorecrawling.entity.CrawlResult;
import com.example.ggstorecrawling.entity.Product;
import com.example.ggstorecrawling.entity.ProductImage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetadataRepository 테스트")
class MetadataRepositoryTest {

    @TempDir
    Path tempDir;

    private final MetadataRepository repository = new MetadataRepository();

    private static Product product(String id, int imageCount) {
        List<ProductImage> images = new ArrayList<>();
        for (int i = 1; i <= imageCount; i++) {
            images.add(ProductImage.builder()
                    .filename(String.format("%s_%02d.jpg", id, i))
                    .originalUrl("https://ggstore.com/cdn/shop/files/" + id + "-" + i + ".jpg")
                    .localPath("data/images/" + String.format("%s_%02d.jpg", id, i))
                    .downloadedAt(LocalDateTime.of(2024, 5, 1, 12, 0))
                    .build());
        }
        return Product.builder()
                .id(id)
                .name("Name " + id)
                .url("https://ggstore.com/products/" + id)
                .price("$10.00")
                .images(images)
                .crawledAt(LocalDateTime.of(2024, 5, 1, 12, 0))
                .build();
    }

    @Test
    @DisplayName("저장한 결과를 다시 읽으면 상품과 이미지가 그대로 복원된다")
    void saveAndLoad() {
        Path file = tempDir.resolve("data/metadata.json");
        CrawlResult result = new CrawlResult(LocalDateTime.of(2024, 5, 1, 12, 0));
        result.addProduct(product("classic-tee", 2));
        result.addProduct(product("canvas-tote", 1));

        repository.save(result, file);
        CrawlResult loaded = repository.load(file).orElseThrow();

        assertEquals(2, loaded.getTotalProducts());
        assertEquals(3, loaded.getTotalImages());
        assertEquals("classic-tee_02.jpg", loaded.getProducts().get(0).getImages().get(1).getFilename());
        assertEquals(result.getCrawledAt(), loaded.getCrawledAt());
        assertEquals(Set.of("classic-tee", "canvas-tote"), repository.getDownloadedProductIds(file));
    }

    @Test
    @DisplayName("파일에 적힌 합계는 무시하고 상품 목록에서 다시 계산한다")
    void totals_areRecomputed() throws IOException {
        Path file = tempDir.resolve("metadata.json");
        Files.writeString(file, "{\"products\":[{\"id\":\"a\",\"name\":\"A\",\"url\":\"u\",\"images\":[]}],"
                + "\"total_products\":99,\"total_images\":99,\"crawled_at\":\"2024-05-01T12:00:00\"}", StandardCharsets.UTF_8);

        CrawlResult loaded = repository.load(file).orElseThrow();

        assertEquals(1, loaded.getTotalProducts());
        assertEquals(0, loaded.getTotalImages());
    }

    @Test
    @DisplayName("파일이 없거나 깨져 있으면 비어 있는 결과로 취급한다")
    void missingOrCorruptFile() throws IOException {
        assertTrue(repository.load(tempDir.resolve("none.json")).isEmpty());

        Path corrupt = tempDir.resolve("corrupt.json");
        Files.writeString(corrupt, "{ not json", StandardCharsets.UTF_8);
        assertTrue(repository.load(corrupt).isEmpty());
        assertTrue(repository.getDownloadedProductIds(corrupt).isEmpty());
    }

    @Test
    @DisplayName("JSON 필드명은 snake_case 로 저장된다")
    void writesSnakeCase() throws IOException {
        Path file = tempDir.resolve("metadata.json");
        CrawlResult result = new CrawlResult(LocalDateTime.of(2024, 5, 1, 12, 0));
        result.addProduct(product("classic-tee", 1));

        repository.save(result, file);
        String json = Files.readString(file, StandardCharsets.UTF_8);

        assertTrue(json.contains("\"total_products\""));
        assertTrue(json.contains("\"original_url\""));
        assertTrue(json.contains("\"crawled_at\""));
        assertTrue(json.contains("\"2024-05-01T12:00"));
        assertFalse(Files.exists(tempDir.resolve("metadata.json.tmp")));
    }
}
