package com.example.ggstorecrawling.repository;

import com.example.ggstorecrawling.ledger.CrawlLedger;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;

/**
 * 장부(체크리스트) 저장소 (store_parser_checklist.yaml)
 *
 * 변경이 있을 때마다 문서 전체를 다시 씁니다. 임시 파일에 쓴 뒤 교체하므로
 * 도중에 프로세스가 죽어도 파일은 마지막으로 끝난 작업 시점의 상태로 남습니다.
 */
@Slf4j
@Repository
public class LedgerRepository {

    private final ObjectMapper yamlMapper;

    public LedgerRepository() {
        YAMLFactory yamlFactory = YAMLFactory.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .build();
        this.yamlMapper = new ObjectMapper(yamlFactory)
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * 장부를 읽습니다. 파일이 없거나 비어 있으면 새 장부를 반환합니다.
     * 내용이 깨진 경우에는 기존 이력을 덮어쓰지 않도록 예외를 던집니다.
     */
    public CrawlLedger load(Path ledgerFile) {
        try {
            if (!Files.exists(ledgerFile) || Files.size(ledgerFile) == 0) {
                log.info("장부 파일이 없어 새로 시작합니다: {}", ledgerFile);
                return new CrawlLedger();
            }
            CrawlLedger ledger = yamlMapper.readValue(ledgerFile.toFile(), CrawlLedger.class);
            return ledger == null ? new CrawlLedger() : ledger;
        } catch (IOException e) {
            throw new StorageException("장부 파일을 읽을 수 없습니다: " + ledgerFile, e);
        }
    }

    /**
     * 장부 객체의 깊은 복사본. 파일에 쓰는 것과 같은 형태로 직렬화했다가 다시 읽습니다.
     * 크롤링 스레드가 갱신 중인 객체를 다른 스레드(REST 응답 등)에 그대로 넘기지 않기 위해 사용합니다.
     */
    public <T> T copyOf(T value, Class<T> type) {
        if (value == null) {
            return null;
        }
        try {
            return yamlMapper.readValue(yamlMapper.writeValueAsBytes(value), type);
        } catch (IOException e) {
            throw new StorageException("장부 항목을 복사할 수 없습니다: " + type.getSimpleName(), e);
        }
    }

    public void save(CrawlLedger ledger, Path ledgerFile) {
        ledger.setUpdatedAt(LocalDateTime.now());
        Path temp = ledgerFile.resolveSibling(ledgerFile.getFileName() + ".tmp");
        try {
            Path parent = ledgerFile.toAbsolutePath().getParent();
            if (parent != null) {
                FileUtils.forceMkdir(parent.toFile());
            }
            yamlMapper.writeValue(temp.toFile(), ledger);
            Files.move(temp, ledgerFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            FileUtils.deleteQuietly(temp.toFile());
            throw new StorageException("장부 저장 실패: " + ledgerFile, e);
        }
    }
}
