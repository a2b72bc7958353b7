package com.cronweibo.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * application.properties 의 "cronweibo.*" 키들을 객체로 바인딩하는 설정 클래스입니다.
 * - weibo.*  : 인증에 반드시 필요한 값 (비어 있으면 기동 실패)
 * - http.*   : 수동 실행 HTTP 게이트웨이 (선택)
 * - retry.*  : 게시 재시도 정책 (선택)
 */
@Component
@Validated
@ConfigurationProperties(prefix = "cronweibo")
@ToString
@Getter
@Setter
public class CronweiboProperties {

    /** 로그/화면에 표시할 앱 이름 */
    private String appName = "cronweibo";

    /** 모든 시간 계산(토큰 수명, cron)에 쓰는 타임존 */
    @NotBlank
    private String timezone = "Asia/Shanghai";

    /** 웨이보 인증/게시 관련 설정 */
    @Valid
    @NotNull
    private Weibo weibo = new Weibo();

    /** HTTP 게이트웨이 설정 */
    @Valid
    private Http http = new Http();

    /** 게시 재시도 정책 */
    @Valid
    private Retry retry = new Retry();

    /** 스케줄러 스레드 풀 */
    @Valid
    private Scheduler scheduler = new Scheduler();

    /** 번들 예제 작업(helloworld) 설정 */
    private Example example = new Example();

    @ToString
    @Getter
    @Setter
    public static class Weibo {
        @NotBlank
        private String appKey;
        @ToString.Exclude
        @NotBlank
        private String appSecret;
        @NotBlank
        private String redirectUri;
        @NotBlank
        private String username;
        @ToString.Exclude
        @NotBlank
        private String password;
        /** 게시 본문에 반드시 포함되어야 하는 안전 링크 */
        @NotBlank
        private String securityUrl;
    }

    @ToString
    @Getter
    @Setter
    public static class Http {
        /** "host:port" 또는 ":port" 형식. 비어 있으면 HTTP 게이트웨이를 띄우지 않음 */
        private String addr = "";
        private String basicAuthUsername = "";
        @ToString.Exclude
        private String basicAuthPassword = "";
    }

    @ToString
    @Getter
    @Setter
    public static class Retry {
        /** 첫 시도 이후 추가 시도 횟수 */
        @Min(0)
        private int count = 3;
        /** 시도 사이 대기 시간 */
        @NotNull
        private Duration interval = Duration.ofSeconds(5);
    }

    @ToString
    @Getter
    @Setter
    public static class Scheduler {
        @Min(1)
        private int poolSize = 4;
    }

    @ToString
    @Getter
    @Setter
    public static class Example {
        private boolean enabled = false;
    }
}
