package com.cronweibo.service;

import com.cronweibo.entity.AccessToken;

import java.time.ZonedDateTime;

/**
 * 웨이보 access_token 의 수명을 관리하는 서비스 계층입니다.
 * - 만료 여부 확인, 직렬화된 갱신, 원자적 교체를 담당합니다.
 */
public interface TokenService {

    /**
     * 토큰이 만료되었으면 갱신합니다. 유효하면 아무 일도 하지 않습니다.
     * @throws com.cronweibo.exception.TokenRefreshException 갱신 실패 시 (기존 토큰 유지)
     */
    void ensureValid();

    /** 현재 토큰 스냅샷 */
    AccessToken currentToken();

    /** 설정된 타임존 기준 현재 시각 */
    ZonedDateTime now();
}
