package com.cronweibo.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.SpringApplication;
import org.springframework.mock.env.MockEnvironment;

import static org.junit.jupiter.api.Assertions.*;

class HttpGatewayEnvironmentPostProcessorTest {

    private final HttpGatewayEnvironmentPostProcessor processor = new HttpGatewayEnvironmentPostProcessor();

    @Test
    void emptyAddrDisablesWebServer() {
        MockEnvironment env = new MockEnvironment().withProperty("cronweibo.http.addr", "");

        processor.postProcessEnvironment(env, new SpringApplication());

        assertEquals("none", env.getProperty("spring.main.web-application-type"));
        assertNull(env.getProperty("server.port"));
    }

    @Test
    void missingAddrDisablesWebServer() {
        MockEnvironment env = new MockEnvironment();

        processor.postProcessEnvironment(env, new SpringApplication());

        assertEquals("none", env.getProperty("spring.main.web-application-type"));
    }

    @Test
    void portOnlyAddr() {
        MockEnvironment env = new MockEnvironment().withProperty("cronweibo.http.addr", ":2222");

        processor.postProcessEnvironment(env, new SpringApplication());

        assertEquals("2222", env.getProperty("server.port"));
        assertNull(env.getProperty("server.address"));
        assertNull(env.getProperty("spring.main.web-application-type"));
    }

    @Test
    void hostAndPortAddr() {
        MockEnvironment env = new MockEnvironment().withProperty("cronweibo.http.addr", "127.0.0.1:8080");

        processor.postProcessEnvironment(env, new SpringApplication());

        assertEquals("127.0.0.1", env.getProperty("server.address"));
        assertEquals("8080", env.getProperty("server.port"));
    }

    @Test
    void invalidAddrFailsStartup() {
        MockEnvironment env = new MockEnvironment().withProperty("cronweibo.http.addr", "localhost:http");

        assertThrows(IllegalStateException.class, () -> processor.postProcessEnvironment(env, new SpringApplication()));
    }
}
