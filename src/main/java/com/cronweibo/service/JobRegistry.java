package com.cronweibo.service;

import com.cronweibo.entity.CronJob;
import com.cronweibo.entity.WeiboJob;

import java.util.List;
import java.util.Optional;

/**
 * 등록된 작업 목록을 보관하고 스케줄러에 연결하는 서비스 계층입니다.
 * 등록은 {@link #start()} 전 단일 스레드에서만 수행합니다.
 */
public interface JobRegistry {

    void registerWeiboJobs(WeiboJob... jobs);

    void registerCronJobs(CronJob... jobs);

    /** 등록을 마감하고 유효한 스케줄을 모두 걸어 둡니다. stop() 뒤에는 다시 걸 수 있습니다. */
    void start();

    /** 걸어 둔 스케줄을 모두 취소합니다. */
    void stop();

    /** 등록이 마감되었는지 (한 번 start() 되면 계속 true) */
    boolean isStarted();

    Optional<WeiboJob> findWeiboJob(String name);

    Optional<CronJob> findCronJob(String name);

    /** 등록 순서대로의 불변 스냅샷 */
    List<WeiboJob> weiboJobs();

    List<CronJob> cronJobs();
}
