package com;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 애플리케이션의 진입점(메인 클래스)입니다.
 * - @SpringBootApplication : 컴포넌트 스캔, 자동 설정, 설정 바인딩 등 부트 핵심을 활성화합니다.
 * - 작업 스케줄은 CronweiboScheduler 가 애플리케이션 라이프사이클에 맞춰 시작/중지합니다.
 *   (cronweibo.http.addr 가 비어 있으면 웹 서버 없이 스케줄러만 동작)
 */
@SpringBootApplication
public class CronweiboApplication {

    /** 자바 애플리케이션 시작 진입점 */
    public static void main(String[] args) {

        SpringApplication.run(CronweiboApplication.class, args);
    }
}
