package com.cronweibo.exception;

/**
 * access_token 발급/갱신 실패.
 * 기동 중이면 치명적이고, 실행 중이면 해당 실행만 중단됩니다.
 */
public class TokenRefreshException extends RuntimeException {

    public TokenRefreshException(String message) {
        super(message);
    }

    public TokenRefreshException(String message, Throwable cause) {
        super(message, cause);
    }
}
