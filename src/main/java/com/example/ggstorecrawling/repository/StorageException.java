package com.example.ggstorecrawling.repository;

/**
 * 장부/메타데이터 파일을 읽거나 쓸 수 없을 때 발생
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
