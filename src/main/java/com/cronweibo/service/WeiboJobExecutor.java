package com.cronweibo.service;

import com.cronweibo.entity.CronJob;
import com.cronweibo.entity.ExecutionResult;
import com.cronweibo.entity.WeiboJob;

/**
 * 작업 실행 파이프라인입니다.
 * 스케줄러와 HTTP 수동 실행 두 진입점에서 같은 구현을 재사용합니다.
 * 어떤 실패도 예외로 빠져나가지 않고 {@link ExecutionResult} 로 돌려줍니다.
 */
public interface WeiboJobExecutor {

    /** 내용 생성 → 안전 링크 보강 → 토큰 확인 → 게시(재시도) */
    ExecutionResult execute(WeiboJob job);

    /** 일반 작업 실행 (보강/토큰/재시도 없음) */
    ExecutionResult execute(CronJob job);

    /** 본문에 안전 링크가 없으면 한 번만 덧붙입니다. */
    String augment(String text);
}
