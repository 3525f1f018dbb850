package com.example.ggstorecrawling.repository;

import com.example.ggstorecrawling.entity.CrawlResult;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;

/**
 * 메타데이터 저장소 (metadata.json)
 *
 * 완료된 크롤링의 상품/이미지 정보를 JSON 으로 저장하고,
 * 다음 실행에서 "이미 다운로드된 상품 ID" 목록을 만들 때 사용합니다.
 */
@Slf4j
@Repository
public class MetadataRepository {

    private final ObjectMapper objectMapper;

    public MetadataRepository() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * 저장된 결과를 읽습니다. 파일이 없거나 읽을 수 없으면 비어 있는 Optional.
     */
    public Optional<CrawlResult> load(Path metadataFile) {
        if (!Files.exists(metadataFile)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(metadataFile.toFile(), CrawlResult.class));
        } catch (IOException e) {
            log.error("메타데이터 파일을 읽지 못했습니다: {} - {}", metadataFile, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 결과 전체를 파일에 씁니다 (임시 파일에 쓴 뒤 교체).
     */
    public void save(CrawlResult result, Path metadataFile) {
        Path temp = metadataFile.resolveSibling(metadataFile.getFileName() + ".tmp");
        try {
            Path parent = metadataFile.toAbsolutePath().getParent();
            if (parent != null) {
                FileUtils.forceMkdir(parent.toFile());
            }
            objectMapper.writeValue(temp.toFile(), result);
            Files.move(temp, metadataFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            FileUtils.deleteQuietly(temp.toFile());
            throw new StorageException("메타데이터 저장 실패: " + metadataFile, e);
        }
        log.info("메타데이터 저장 완료: {} (상품 {}개, 이미지 {}개)",
                metadataFile, result.getTotalProducts(), result.getTotalImages());
    }

    /**
     * 이미 다운로드된 상품 ID 목록
     */
    public Set<String> getDownloadedProductIds(Path metadataFile) {
        return load(metadataFile).map(CrawlResult::getProductIds).orElse(Collections.emptySet());
    }
}
