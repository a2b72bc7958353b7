package com.cronweibo.schedule;

import com.cronweibo.entity.CronJob;
import com.cronweibo.entity.WeiboJob;
import com.cronweibo.service.JobRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * 스케줄러 구성 클래스입니다.
 * - 모든 싱글톤이 만들어진 뒤 컨텍스트의 WeiboJob / CronJob 빈을 등록합니다.
 * - 등록이 끝나면 애플리케이션 라이프사이클에 맞춰 스케줄을 시작/중지합니다.
 *   (웹 서버보다 먼저 등록되므로 요청 처리 중에 등록이 일어나지 않습니다)
 */
@Slf4j
@Component
public class CronweiboScheduler implements SmartInitializingSingleton, SmartLifecycle {

    private final JobRegistry registry;
    private final ObjectProvider<WeiboJob> weiboJobs;
    private final ObjectProvider<CronJob> cronJobs;

    private volatile boolean running;

    public CronweiboScheduler(JobRegistry registry, ObjectProvider<WeiboJob> weiboJobs, ObjectProvider<CronJob> cronJobs) {
        this.registry = registry;
        this.weiboJobs = weiboJobs;
        this.cronJobs = cronJobs;
    }

    @Override
    public void afterSingletonsInstantiated() {
        registry.registerWeiboJobs(weiboJobs.orderedStream().toArray(WeiboJob[]::new));
        registry.registerCronJobs(cronJobs.orderedStream().toArray(CronJob[]::new));
    }

    @Override
    public void start() {
        registry.start();
        running = true;
    }

    @Override
    public void stop() {
        log.info("cronweibo scheduler stopping");
        registry.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
