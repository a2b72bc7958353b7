package com.cronweibo.entity;

import lombok.Getter;
import lombok.ToString;

/**
 * 작업 1회 실행 결과입니다.
 * 타이머 경로에서는 로그로만 남고, HTTP 경로에서는 응답 HTML 로 렌더링됩니다.
 */
@Getter
@ToString
public class ExecutionResult {

    private final String jobName;
    private final boolean success;
    /** 게시 시도 횟수 (토큰 확인 실패 시 0) */
    private final int attempts;
    /** 실패한 게시 시도 횟수 */
    private final int failures;
    /** 성공 시 게시물 확인 주소 */
    private final String weiboUrl;
    /** 실패 시 오류 메시지 */
    private final String error;

    private ExecutionResult(String jobName, boolean success, int attempts, int failures, String weiboUrl, String error) {
        this.jobName = jobName;
        this.success = success;
        this.attempts = attempts;
        this.failures = failures;
        this.weiboUrl = weiboUrl;
        this.error = error;
    }

    public static ExecutionResult published(String jobName, int attempts, String weiboUrl) {
        return new ExecutionResult(jobName, true, attempts, attempts - 1, weiboUrl, null);
    }

    public static ExecutionResult done(String jobName) {
        return new ExecutionResult(jobName, true, 0, 0, null, null);
    }

    public static ExecutionResult failed(String jobName, int attempts, String error) {
        return new ExecutionResult(jobName, false, attempts, attempts, null, error);
    }
}
