package com.cronweibo.config;

import com.cronweibo.client.WeiboApiClient;
import com.cronweibo.client.WeiboClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 스케줄러 스레드 풀, 서비스 시계, 웨이보 클라이언트 빈 구성입니다.
 */
@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean
    public ThreadPoolTaskScheduler taskScheduler(CronweiboProperties props) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getScheduler().getPoolSize());
        scheduler.setThreadNamePrefix("cronweibo-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(t -> log.error("scheduled job error", t));
        log.info("task scheduler initialized with pool size {}", props.getScheduler().getPoolSize());
        return scheduler;
    }

    /** 토큰 수명 계산 등 모든 시간 계산은 설정된 타임존 시계를 사용 */
    @Bean
    public Clock cronweiboClock(CronweiboProperties props) {
        return Clock.system(ZoneId.of(props.getTimezone()));
    }

    @Bean
    public WeiboClient weiboClient(CronweiboProperties props, ObjectMapper objectMapper) {
        return new WeiboApiClient(props.getWeibo(), objectMapper);
    }
}
