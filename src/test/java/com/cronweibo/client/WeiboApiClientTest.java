package com.cronweibo.client;

import com.cronweibo.TestProperties;
import com.cronweibo.entity.AccessToken;
import com.cronweibo.entity.ShareResponse;
import com.cronweibo.exception.WeiboApiException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/** 로컬 HttpServer 로 웨이보 API 를 흉내 내어 요청/응답 처리를 확인합니다. */
class WeiboApiClientTest {

    private HttpServer server;
    private WeiboApiClient client;
    private final Map<String, String> requestBodies = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.start();
        String base = "http://127.0.0.1:" + server.getAddress().getPort();
        client = new WeiboApiClient(TestProperties.create(0).getWeibo(), new ObjectMapper(), base, base);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void respond(String path, int status, String body, Map<String, String> headers) {
        server.createContext(path, exchange -> {
            requestBodies.put(path, new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            headers.forEach((k, v) -> exchange.getResponseHeaders().add(k, v));
            write(exchange, status, body);
        });
    }

    private static void write(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            exchange.getResponseBody().write(bytes);
        }
        exchange.close();
    }

    @Test
    void loginAuthorizeAndExchange() {
        respond("/sso/login", 200, "{\"retcode\":20000000,\"msg\":\"\"}", Map.of());
        respond("/oauth2/authorize", 302, "", Map.of("Location", "http://localhost/callback?code=abc123&state=x"));
        respond("/oauth2/access_token", 200,
                "{\"access_token\":\"2.00tok\",\"expires_in\":157679999,\"uid\":\"42\"}", Map.of());

        client.login();
        String code = client.authorize();
        AccessToken token = client.accessToken(code);

        assertEquals("abc123", code);
        assertEquals("2.00tok", token.getAccessToken());
        assertEquals(157679999L, token.getExpiresIn());
        assertEquals("42", token.getUid());
        assertTrue(requestBodies.get("/sso/login").contains("username=user"));
        assertTrue(requestBodies.get("/oauth2/access_token").contains("grant_type=authorization_code"));
        assertTrue(requestBodies.get("/oauth2/access_token").contains("code=abc123"));
    }

    @Test
    void rejectedLoginThrows() {
        respond("/sso/login", 200, "{\"retcode\":50011002,\"msg\":\"wrong password\"}", Map.of());

        WeiboApiException e = assertThrows(WeiboApiException.class, client::login);
        assertTrue(e.getMessage().contains("50011002"));
    }

    @Test
    void authorizeWithoutCodeThrows() {
        respond("/oauth2/authorize", 200, "<html>login page</html>", Map.of());

        WeiboApiException e = assertThrows(WeiboApiException.class, client::authorize);
        assertEquals(200, e.getStatusCode());
    }

    @Test
    void shareSendsMultipartAndReadsProfileUrl() {
        respond("/2/statuses/share.json", 200, "{\"idstr\":\"100\",\"user\":{\"profile_url\":\"u/42\"}}", Map.of());

        ShareResponse resp = client.statusesShare("2.00tok", "hello world\nhttp://sec.example.com", new byte[]{7, 7});

        assertEquals("100", resp.getId());
        assertEquals("http://weibo.com/u/42", resp.weiboUrl());
        String body = requestBodies.get("/2/statuses/share.json");
        assertTrue(body.contains("name=\"access_token\"\r\n\r\n2.00tok"));
        assertTrue(body.contains("hello world\nhttp://sec.example.com"));
        assertTrue(body.contains("name=\"pic\"; filename=\"pic.jpg\""));
    }

    @Test
    void shareErrorBecomesException() {
        respond("/2/statuses/share.json", 400, "{\"error\":\"repeated weibo text\",\"error_code\":20019}", Map.of());

        WeiboApiException e = assertThrows(WeiboApiException.class,
                () -> client.statusesShare("2.00tok", "dup", null));
        assertEquals(400, e.getStatusCode());
        assertTrue(e.getMessage().contains("20019"));
        assertTrue(e.bodyPreview().contains("repeated"));
    }

    @Test
    void extractsQueryParam() {
        assertEquals("a b", WeiboApiClient.queryParam("http://x/cb?state=1&code=a%20b", "code"));
        assertNull(WeiboApiClient.queryParam("http://x/cb", "code"));
        assertNull(WeiboApiClient.queryParam(null, "code"));
    }
}
