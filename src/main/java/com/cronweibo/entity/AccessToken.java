package com.cronweibo.entity;

import lombok.Getter;
import lombok.ToString;

/**
 * 웨이보 access_token 과 발급 시각을 함께 담는 불변 객체입니다.
 * 갱신 시에는 필드를 바꾸지 않고 객체 전체를 교체합니다.
 */
@Getter
@ToString
public class AccessToken {

    @ToString.Exclude
    private final String accessToken;

    /** 유효 기간(초) */
    private final long expiresIn;

    private final String uid;

    /** 발급 시각(epoch 초) */
    private final long createdAt;

    public AccessToken(String accessToken, long expiresIn, String uid, long createdAt) {
        this.accessToken = accessToken;
        this.expiresIn = expiresIn;
        this.uid = uid;
        this.createdAt = createdAt;
    }

    /** 발급 시각만 바꾼 사본 */
    public AccessToken issuedAt(long epochSecond) {
        return new AccessToken(accessToken, expiresIn, uid, epochSecond);
    }

    public long ageAt(long nowEpochSecond) {
        return nowEpochSecond - createdAt;
    }

    public boolean isExpiredAt(long nowEpochSecond) {
        return ageAt(nowEpochSecond) >= expiresIn;
    }
}
