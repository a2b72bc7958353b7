package com.cronweibo.config;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * cronweibo.http.addr 를 Spring Boot 서버 설정으로 옮깁니다.
 * - "host:port" → server.address + server.port
 * - ":port"     → server.port
 * - 비어 있음   → 웹 서버를 띄우지 않음 (스케줄러만 동작)
 */
public class HttpGatewayEnvironmentPostProcessor implements EnvironmentPostProcessor {

    static final String ADDR_KEY = "cronweibo.http.addr";
    static final String SOURCE_NAME = "cronweiboHttpGateway";

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        Map<String, Object> mapped = new HashMap<>();
        String addr = environment.getProperty(ADDR_KEY);
        if (!StringUtils.hasText(addr)) {
            mapped.put("spring.main.web-application-type", "none");
        } else {
            String trimmed = addr.trim();
            int colon = trimmed.lastIndexOf(':');
            if (colon < 0) {
                throw new IllegalStateException("invalid " + ADDR_KEY + " (expected host:port or :port): " + addr);
            }
            String host = trimmed.substring(0, colon);
            String port = trimmed.substring(colon + 1);
            try {
                Integer.parseInt(port);
            } catch (NumberFormatException e) {
                throw new IllegalStateException("invalid port in " + ADDR_KEY + ": " + addr, e);
            }
            if (!host.isEmpty()) {
                mapped.put("server.address", host);
            }
            mapped.put("server.port", port);
        }
        environment.getPropertySources().addFirst(new MapPropertySource(SOURCE_NAME, mapped));
    }
}
