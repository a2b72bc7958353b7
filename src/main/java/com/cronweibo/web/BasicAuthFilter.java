package com.cronweibo.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * 작업 실행/목록 엔드포인트 앞에 HTTP Basic 인증을 거는 필터입니다.
 * - 사용자명/비밀번호는 상수 시간 비교(MessageDigest.isEqual)로 확인합니다.
 * - 실패 시 401 + WWW-Authenticate 헤더를 내려주고 다음 체인을 호출하지 않습니다.
 */
@Slf4j
public class BasicAuthFilter extends OncePerRequestFilter {

    static final String REALM = "Basic realm=\"cronweibo\"";
    static final String UNAUTHORIZED_BODY = "You are Unauthorized to access the application.\n";

    private final byte[] username;
    private final byte[] password;

    public BasicAuthFilter(String username, String password) {
        this.username = username.getBytes(StandardCharsets.UTF_8);
        this.password = password.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String[] credentials = extractCredentials(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (credentials == null || !matches(credentials[0], credentials[1])) {
            log.debug("unauthorized request {} from {}", request.getRequestURI(), request.getRemoteAddr());
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, REALM);
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.TEXT_PLAIN_VALUE);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            response.getWriter().write(UNAUTHORIZED_BODY);
            return;
        }
        filterChain.doFilter(request, response);
    }

    private boolean matches(String user, String pass) {
        // 두 값 모두 항상 비교 (단락 평가 없이)
        boolean userOk = MessageDigest.isEqual(user.getBytes(StandardCharsets.UTF_8), username);
        boolean passOk = MessageDigest.isEqual(pass.getBytes(StandardCharsets.UTF_8), password);
        return userOk & passOk;
    }

    /** "Basic base64(user:pass)" → [user, pass], 형식이 틀리면 null */
    static String[] extractCredentials(String header) {
        if (header == null || !header.regionMatches(true, 0, "Basic ", 0, 6)) {
            return null;
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(header.substring(6).trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return null;
        }
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            return null;
        }
        return new String[]{decoded.substring(0, colon), decoded.substring(colon + 1)};
    }
}
