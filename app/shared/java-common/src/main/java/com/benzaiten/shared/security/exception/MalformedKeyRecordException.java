package com.benzaiten.shared.security.exception;

/**
 * 저장소 레코드의 속성 형태가 예상과 다른 경우 (데이터 무결성 오류)
 */
public class MalformedKeyRecordException extends RuntimeException {

    public MalformedKeyRecordException(String message) {
        super(message);
    }

    public MalformedKeyRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
