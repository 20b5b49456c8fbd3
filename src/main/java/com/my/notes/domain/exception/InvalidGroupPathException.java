package com.my.notes.domain.exception;

/**
 * 왜: 그룹 경로가 루트 밖을 가리키거나 허용되지 않는 세그먼트를 담고 있을 때 저장소에 닿기 전에 실패시키기 위함.
 */
public class InvalidGroupPathException extends RuntimeException {

    private final String rawPath;

    public InvalidGroupPathException(String rawPath, String message) {
        super(message + ": " + rawPath);
        this.rawPath = rawPath;
    }

    public String rawPath() {
        return rawPath;
    }
}
