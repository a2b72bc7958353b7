package com.cronweibo.exception;

/**
 * 웨이보 API 호출(로그인/인가/토큰 교환/게시) 실패를 나타냅니다.
 * statusCode 가 0 이면 응답을 받기 전에 실패한 경우(I/O 오류 등)입니다.
 */
public class WeiboApiException extends RuntimeException {
    private static final int BODY_PREVIEW_MAX = 500;

    private final int statusCode;
    private final String responseBody;

    public WeiboApiException(String message) {
        this(0, message, null);
    }

    public WeiboApiException(int statusCode, String message, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public WeiboApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.responseBody = null;
    }

    public static WeiboApiException of(int statusCode, String path, String body) {
        return new WeiboApiException(statusCode, "Weibo API failed: " + statusCode + " on " + path, body);
    }

    public int getStatusCode() { return statusCode; }
    public String getResponseBody() { return responseBody; }

    public String bodyPreview() {
        if (responseBody == null) return null;
        return responseBody.length() <= BODY_PREVIEW_MAX
                ? responseBody
                : responseBody.substring(0, BODY_PREVIEW_MAX) + "...(truncated)";
    }

    @Override
    public String toString() {
        return "WeiboApiException{statusCode=" + statusCode +
                ", message=" + getMessage() +
                ", bodyPreview=" + (responseBody == null ? "null" : bodyPreview()) +
                '}';
    }
}
