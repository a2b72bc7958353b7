package com.cronweibo.service.impl;

import com.cronweibo.client.WeiboClient;
import com.cronweibo.entity.AccessToken;
import com.cronweibo.exception.TokenRefreshException;
import com.cronweibo.service.TokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@Service("TokenService")
public class TokenServiceImpl implements TokenService {

    private final WeiboClient weiboClient;
    private final Clock clock;

    /** 읽기는 스냅샷, 쓰기는 refreshLock 아래에서 통째로 교체 */
    private final AtomicReference<AccessToken> token = new AtomicReference<>();
    private final ReentrantLock refreshLock = new ReentrantLock();
    /** 갱신 시도 횟수. 락을 기다리는 동안 다른 스레드가 시도했는지 판단하는 데 씁니다. */
    private final AtomicLong refreshAttempts = new AtomicLong();

    /**
     * 생성 시점에 로그인 → 인가 → 토큰 교환을 수행합니다.
     * 실패하면 빈 생성 자체가 실패하여 애플리케이션이 기동되지 않습니다.
     */
    public TokenServiceImpl(WeiboClient weiboClient, Clock clock) {
        this.weiboClient = weiboClient;
        this.clock = clock;
        log.info("cronweibo is initializing...");
        token.set(fetchToken());
        log.info("cronweibo initialize successful. token={}", token.get());
    }

    @Override
    public void ensureValid() {
        AccessToken snapshot = token.get();
        long now = nowEpochSecond();
        log.debug("check token age={}, expiresIn={}", snapshot.ageAt(now), snapshot.getExpiresIn());
        if (!snapshot.isExpiredAt(now)) {
            return;
        }

        long seenAttempts = refreshAttempts.get();
        refreshLock.lock();
        try {
            if (refreshAttempts.get() != seenAttempts) {
                // 기다리는 동안 다른 스레드가 갱신을 시도함: 결과만 확인하고 다시 시도하지 않음
                if (token.get().isExpiredAt(nowEpochSecond())) {
                    throw new TokenRefreshException("token is still expired after a concurrent refresh failed");
                }
                return;
            }
            if (!token.get().isExpiredAt(nowEpochSecond())) {
                return;
            }
            try {
                AccessToken refreshed = fetchToken();
                token.set(refreshed);
                log.info("token expired, set a new token: {}", refreshed);
            } finally {
                // 시도가 끝난 뒤에 올려야 락을 기다리던 스레드가 이번 시도를 알아챔
                refreshAttempts.incrementAndGet();
            }
        } finally {
            refreshLock.unlock();
        }
    }

    @Override
    public AccessToken currentToken() {
        return token.get();
    }

    @Override
    public ZonedDateTime now() {
        return ZonedDateTime.now(clock);
    }

    private AccessToken fetchToken() {
        try {
            weiboClient.login();
        } catch (RuntimeException e) {
            throw new TokenRefreshException("login weibo error", e);
        }
        String code;
        try {
            code = weiboClient.authorize();
        } catch (RuntimeException e) {
            throw new TokenRefreshException("get authorize code error", e);
        }
        log.debug("got authorize code");
        try {
            return weiboClient.accessToken(code).issuedAt(nowEpochSecond());
        } catch (RuntimeException e) {
            throw new TokenRefreshException("get access token error", e);
        }
    }

    private long nowEpochSecond() {
        return now().toEpochSecond();
    }
}
