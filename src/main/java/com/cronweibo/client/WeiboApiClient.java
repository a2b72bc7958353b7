package com.cronweibo.client;

import com.cronweibo.config.CronweiboProperties;
import com.cronweibo.entity.AccessToken;
import com.cronweibo.entity.ShareResponse;
import com.cronweibo.exception.WeiboApiException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.CookieManager;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * JDK HttpClient 로 웨이보 OAuth2 / statuses API 를 호출하는 구현체입니다.
 * - 로그인 세션은 CookieManager 에 보관됩니다.
 * - 리다이렉트는 따라가지 않습니다 (인가 코드를 Location 헤더에서 읽기 위해).
 */
@Slf4j
public class WeiboApiClient implements WeiboClient {

    public static final String DEFAULT_API_BASE = "https://api.weibo.com";
    public static final String DEFAULT_PASSPORT_BASE = "https://passport.weibo.cn";

    private static final String LOGIN_SUCCESS = "20000000";

    private final CronweiboProperties.Weibo weibo;
    private final ObjectMapper objectMapper;
    private final HttpClient client;
    private final String apiBase;
    private final String passportBase;

    public WeiboApiClient(CronweiboProperties.Weibo weibo, ObjectMapper objectMapper) {
        this(weibo, objectMapper, DEFAULT_API_BASE, DEFAULT_PASSPORT_BASE);
    }

    public WeiboApiClient(CronweiboProperties.Weibo weibo, ObjectMapper objectMapper,
                          String apiBase, String passportBase) {
        this.weibo = weibo;
        this.objectMapper = objectMapper;
        this.apiBase = apiBase;
        this.passportBase = passportBase;
        this.client = HttpClient.newBuilder()
                .cookieHandler(new CookieManager())
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public void login() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("username", weibo.getUsername());
        form.put("password", weibo.getPassword());
        form.put("savestate", "1");
        form.put("ec", "0");
        form.put("entry", "mweibo");
        form.put("mainpageflag", "1");

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(passportBase + "/sso/login"))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Referer", passportBase + "/signin/login")
                .POST(HttpRequest.BodyPublishers.ofString(formBody(form)))
                .build();

        HttpResponse<String> resp = send(req, "/sso/login");
        JsonNode body = readJson(resp, "/sso/login");
        String retcode = body.path("retcode").asText();
        if (!LOGIN_SUCCESS.equals(retcode)) {
            throw new WeiboApiException(resp.statusCode(),
                    "Weibo login rejected: retcode=" + retcode + " msg=" + body.path("msg").asText(), resp.body());
        }
        log.debug("weibo login ok for {}", weibo.getUsername());
    }

    @Override
    public String authorize() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", weibo.getAppKey());
        form.put("redirect_uri", weibo.getRedirectUri());
        form.put("response_type", "code");
        form.put("action", "submit");
        form.put("userId", weibo.getUsername());
        form.put("passwd", weibo.getPassword());

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(apiBase + "/oauth2/authorize"))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Referer", apiBase + "/oauth2/authorize")
                .POST(HttpRequest.BodyPublishers.ofString(formBody(form)))
                .build();

        HttpResponse<String> resp = send(req, "/oauth2/authorize");
        String location = resp.headers().firstValue("Location").orElse(null);
        String code = queryParam(location, "code");
        if (code == null || code.isBlank()) {
            throw WeiboApiException.of(resp.statusCode(), "/oauth2/authorize", resp.body());
        }
        return code;
    }

    @Override
    public AccessToken accessToken(String code) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", weibo.getAppKey());
        form.put("client_secret", weibo.getAppSecret());
        form.put("grant_type", "authorization_code");
        form.put("code", code);
        form.put("redirect_uri", weibo.getRedirectUri());

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(apiBase + "/oauth2/access_token"))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(formBody(form)))
                .build();

        HttpResponse<String> resp = send(req, "/oauth2/access_token");
        JsonNode body = readJson(resp, "/oauth2/access_token");
        String token = body.path("access_token").asText(null);
        if (resp.statusCode() != 200 || token == null) {
            throw WeiboApiException.of(resp.statusCode(), "/oauth2/access_token", resp.body());
        }
        return new AccessToken(token, body.path("expires_in").asLong(), body.path("uid").asText(null), 0L);
    }

    @Override
    public ShareResponse statusesShare(String accessToken, String text, byte[] pic) {
        String boundary = "----cronweibo" + UUID.randomUUID().toString().replace("-", "");
        byte[] multipart = multipartBody(boundary, accessToken, text, pic);

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(apiBase + "/2/statuses/share.json"))
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .POST(HttpRequest.BodyPublishers.ofByteArray(multipart))
                .build();

        HttpResponse<String> resp = send(req, "/2/statuses/share.json");
        JsonNode body = readJson(resp, "/2/statuses/share.json");
        if (resp.statusCode() != 200 || body.has("error_code")) {
            throw new WeiboApiException(resp.statusCode(),
                    "Weibo share failed: " + body.path("error_code").asText() + " " + body.path("error").asText(),
                    resp.body());
        }
        return new ShareResponse(body.path("idstr").asText(body.path("id").asText()),
                body.path("user").path("profile_url").asText(""));
    }

    private HttpResponse<String> send(HttpRequest req, String path) {
        try {
            return client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new WeiboApiException("Weibo API I/O error on " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WeiboApiException("Weibo API call interrupted on " + path, e);
        }
    }

    private JsonNode readJson(HttpResponse<String> resp, String path) {
        try {
            return objectMapper.readTree(resp.body());
        } catch (IOException e) {
            throw new WeiboApiException(resp.statusCode(), "Weibo API returned non-JSON body on " + path, resp.body());
        }
    }

    /** URL-encoded form 바디 구성 */
    private static String formBody(Map<String, String> form) {
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                        + "=" + URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    /** Location 헤더 등에서 쿼리 파라미터 하나를 꺼냅니다. */
    static String queryParam(String url, String name) {
        if (url == null) return null;
        int q = url.indexOf('?');
        if (q < 0) return null;
        for (String pair : url.substring(q + 1).split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && pair.substring(0, eq).equals(name)) {
                return URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            }
        }
        return null;
    }

    private static byte[] multipartBody(String boundary, String accessToken, String text, byte[] pic) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeField(out, boundary, "access_token", accessToken);
        writeField(out, boundary, "status", text);
        if (pic != null && pic.length > 0) {
            write(out, "--" + boundary + "\r\n"
                    + "Content-Disposition: form-data; name=\"pic\"; filename=\"pic.jpg\"\r\n"
                    + "Content-Type: application/octet-stream\r\n\r\n");
            out.writeBytes(pic);
            write(out, "\r\n");
        }
        write(out, "--" + boundary + "--\r\n");
        return out.toByteArray();
    }

    private static void writeField(ByteArrayOutputStream out, String boundary, String name, String value) {
        write(out, "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"" + name + "\"\r\n\r\n"
                + (value == null ? "" : value) + "\r\n");
    }

    private static void write(ByteArrayOutputStream out, String s) {
        out.writeBytes(s.getBytes(StandardCharsets.UTF_8));
    }
}
