package com.cronweibo.example;

import com.cronweibo.entity.WeiboContent;
import com.cronweibo.entity.WeiboJob;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 2분마다 "hello world" 를 게시하는 예제 작업입니다.
 * cronweibo.example.enabled=true 일 때만 등록됩니다.
 * 직접 작업을 추가할 때도 이처럼 WeiboJob / CronJob 빈을 선언하면 됩니다.
 */
@Configuration
@ConditionalOnProperty(prefix = "cronweibo.example", name = "enabled", havingValue = "true")
public class HelloWorldJobConfig {

    @Bean
    public WeiboJob helloWorldJob() {
        return new WeiboJob("helloworld", "@every 2m", () -> WeiboContent.text("hello world"));
    }
}
