package com.example.ggstorecrawling.service;

import com.example.ggstorecrawling.client.ImageFetcher;
import com.example.ggstorecrawling.config.CrawlerProperties;
import com.example.ggstorecrawling.entity.ProductImage;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 상품 이미지 다운로드 서비스
 *
 * 파일 저장 규칙:
 * - 파일명: {상품ID}_{순번 2자리}{확장자} (순번은 정규화된 URL 순서, 1부터 시작)
 * - 같은 URL 순서로 다시 실행하면 항상 같은 파일명이 나오므로, 파일이 이미 있으면 다운로드하지 않습니다.
 *
 * 동시에 진행되는 다운로드 수는 세마포어로 제한하고,
 * 실패한 이미지는 결과에서 빠질 뿐 나머지 이미지나 전체 크롤링을 멈추지 않습니다.
 */
@Slf4j
@Service
public class ImageDownloadService {

    /** 확장자를 알 수 없을 때 사용하는 기본값 */
    public static final String DEFAULT_EXTENSION = ".jpg";

    private final ImageFetcher imageFetcher;
    private final int maxConcurrent;
    /** 동시 다운로드 허용 슬롯 */
    private final Semaphore downloadPermits;

    @Autowired
    public ImageDownloadService(ImageFetcher imageFetcher, CrawlerProperties properties) {
        this(imageFetcher, properties.getDownload().getMaxConcurrent());
    }

    public ImageDownloadService(ImageFetcher imageFetcher, int maxConcurrent) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("동시 다운로드 수는 1 이상이어야 합니다: " + maxConcurrent);
        }
        this.imageFetcher = imageFetcher;
        this.maxConcurrent = maxConcurrent;
        this.downloadPermits = new Semaphore(maxConcurrent, true);
    }

    /**
     * 상품 하나의 이미지를 모두 다운로드합니다.
     *
     * @param productId 상품 ID
     * @param imageUrls 정규화된 이미지 URL (순서가 파일 순번을 결정)
     * @param outputDir 저장 폴더
     * @return 디스크에 존재하게 된 이미지 목록 (URL 순서, 실패한 이미지는 제외)
     */
    public List<ProductImage> downloadProductImages(String productId, List<String> imageUrls, Path outputDir) {
        try {
            FileUtils.forceMkdir(outputDir.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("이미지 폴더를 만들 수 없습니다: " + outputDir, e);
        }

        ProductImage[] slots = new ProductImage[imageUrls.size()];
        List<Integer> pending = new ArrayList<>();

        for (int i = 0; i < imageUrls.size(); i++) {
            String url = imageUrls.get(i);
            String filename = imageFilename(productId, i + 1, url);
            Path target = outputDir.resolve(filename);
            if (Files.exists(target)) {
                log.debug("이미 존재하는 이미지, 건너뜀: {}", filename);
                slots[i] = toRecord(filename, url, target);
            } else {
                pending.add(i);
            }
        }

        if (!pending.isEmpty()) {
            ExecutorService pool = Executors.newFixedThreadPool(Math.min(pending.size(), maxConcurrent));
            try {
                List<CompletableFuture<Void>> futures = new ArrayList<>();
                for (int index : pending) {
                    String url = imageUrls.get(index);
                    String filename = imageFilename(productId, index + 1, url);
                    Path target = outputDir.resolve(filename);
                    futures.add(CompletableFuture.runAsync(() -> {
                        if (downloadImage(url, target)) {
                            slots[index] = toRecord(filename, url, target);
                        }
                    }, pool));
                }
                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            } finally {
                pool.shutdown();
                try {
                    pool.awaitTermination(1, TimeUnit.MINUTES);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }

        List<ProductImage> images = Arrays.stream(slots).filter(Objects::nonNull).collect(Collectors.toList());
        if (images.size() < imageUrls.size()) {
            log.warn("[{}] 이미지 {}개 중 {}개만 확보했습니다.", productId, imageUrls.size(), images.size());
        }
        return images;
    }

    /**
     * 이미지 한 장 다운로드. 실패하면 로그만 남기고 false 를 반환합니다.
     * 임시 파일(.part)에 먼저 쓰고 이동하므로, 중간에 종료되어도 잘린 파일이 최종 이름으로 남지 않습니다.
     */
    boolean downloadImage(String url, Path target) {
        try {
            downloadPermits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("이미지 다운로드 대기 중 중단됨: {}", url);
            return false;
        }
        Path temp = target.resolveSibling(target.getFileName() + ".part");
        try {
            byte[] body = imageFetcher.fetch(url);
            FileUtils.writeByteArrayToFile(temp.toFile(), body);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("이미지 저장 성공: {}", target);
            return true;
        } catch (Exception e) {
            log.error("이미지 다운로드 실패: {} - {}", url, e.getMessage());
            FileUtils.deleteQuietly(temp.toFile());
            return false;
        } finally {
            downloadPermits.release();
        }
    }

    /**
     * 이미지 파일명 생성: {상품ID}_{순번 2자리}{확장자}
     */
    public static String imageFilename(String productId, int index, String url) {
        return String.format("%s_%02d%s", productId, index, extensionOf(url));
    }

    /**
     * URL 경로의 확장자. 허용 목록에 없으면 기본값(.jpg)
     */
    static String extensionOf(String url) {
        if (url == null || url.isEmpty()) {
            return DEFAULT_EXTENSION;
        }
        String path = url.split("[?#]", 2)[0];
        String fileName = path.substring(path.lastIndexOf('/') + 1);
        int dotIndex = fileName.lastIndexOf('.');
        if (dotIndex > 0) {
            String ext = fileName.substring(dotIndex).toLowerCase(Locale.ROOT);
            if (ImageUrlNormalizer.IMAGE_EXTENSIONS.contains(ext)) {
                return ext;
            }
        }
        return DEFAULT_EXTENSION;
    }

    private static ProductImage toRecord(String filename, String url, Path target) {
        return ProductImage.builder()
                .filename(filename)
                .originalUrl(url)
                .localPath(target.toString())
                .downloadedAt(LocalDateTime.now())
                .build();
    }
}
