package com.example.ggstorecrawling.ledger;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * metadata.json 과의 동기화 상태
 */
@Getter
@Setter
@NoArgsConstructor
public class MetadataSync {
    private String file = "data/metadata.json";
    private LocalDateTime lastSync;
    private int productsInMetadata;
    private int imagesInMetadata;
    private MetadataSyncStatus syncStatus = MetadataSyncStatus.IN_SYNC;
}
