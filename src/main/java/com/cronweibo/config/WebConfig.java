package com.cronweibo.config;

import com.cronweibo.web.BasicAuthFilter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;

/**
 * HTTP 게이트웨이 구성입니다.
 * - Basic 인증 계정이 설정된 경우에만 작업/목록 경로에 인증 필터를 겁니다.
 */
@Configuration
@ConditionalOnWebApplication
public class WebConfig {

    @Bean
    @Conditional(BasicAuthConfiguredCondition.class)
    public FilterRegistrationBean<BasicAuthFilter> basicAuthFilter(CronweiboProperties props) {
        FilterRegistrationBean<BasicAuthFilter> registration = new FilterRegistrationBean<>(
                new BasicAuthFilter(props.getHttp().getBasicAuthUsername(), props.getHttp().getBasicAuthPassword()));
        registration.addUrlPatterns("/", "/weibo/*", "/cron/*");
        registration.setName("basicAuthFilter");
        return registration;
    }
}
