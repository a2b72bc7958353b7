package com.cronweibo.service.impl;

import com.cronweibo.config.CronweiboProperties;
import com.cronweibo.entity.CronJob;
import com.cronweibo.entity.ExecutionResult;
import com.cronweibo.entity.WeiboJob;
import com.cronweibo.schedule.ScheduleTriggers;
import com.cronweibo.service.JobRegistry;
import com.cronweibo.service.WeiboJobExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

@Slf4j
@Service("JobRegistry")
public class JobRegistryImpl implements JobRegistry {

    private final TaskScheduler taskScheduler;
    private final WeiboJobExecutor executor;
    private final CronweiboProperties props;
    private final ZoneId zone;

    private final List<WeiboJob> weiboJobs = new ArrayList<>();
    private final List<CronJob> cronJobs = new ArrayList<>();
    /** 스케줄 식이 유효한 작업만 담김 */
    private final List<Entry> entries = new ArrayList<>();
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();

    private volatile boolean started;
    /** stop() 후 다시 start() 할 수 있도록 등록 마감과 별도로 관리 */
    private boolean scheduled;

    public JobRegistryImpl(TaskScheduler taskScheduler, WeiboJobExecutor executor, CronweiboProperties props) {
        this.taskScheduler = taskScheduler;
        this.executor = executor;
        this.props = props;
        this.zone = ZoneId.of(props.getTimezone());
    }

    @Override
    public void registerWeiboJobs(WeiboJob... jobs) {
        checkNotStarted();
        for (WeiboJob job : jobs) {
            if (findWeiboJob(job.getName()).isPresent()) {
                log.error("duplicate weibo job name {}, skipped [{}]", job.getName(), props.getAppName());
                continue;
            }
            weiboJobs.add(job);
            addEntry("weibo", job.getName(), job.getSchedule(), () -> logResult(executor.execute(job)));
        }
    }

    @Override
    public void registerCronJobs(CronJob... jobs) {
        checkNotStarted();
        for (CronJob job : jobs) {
            if (findCronJob(job.getName()).isPresent()) {
                log.error("duplicate cron job name {}, skipped [{}]", job.getName(), props.getAppName());
                continue;
            }
            cronJobs.add(job);
            addEntry("cron", job.getName(), job.getSchedule(), () -> executor.execute(job));
        }
    }

    @Override
    public synchronized void start() {
        if (scheduled) {
            throw new IllegalStateException("jobs are already scheduled");
        }
        started = true;
        scheduled = true;
        for (Entry entry : entries) {
            futures.add(taskScheduler.schedule(entry.action, entry.trigger));
        }
        log.info("cronweibo is running with {} weibo jobs, {} cron jobs, {} scheduled [{}]",
                weiboJobs.size(), cronJobs.size(), futures.size(), props.getAppName());
    }

    @Override
    public synchronized void stop() {
        futures.forEach(f -> f.cancel(false));
        futures.clear();
        scheduled = false;
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public Optional<WeiboJob> findWeiboJob(String name) {
        return weiboJobs.stream().filter(j -> j.getName().equals(name)).findFirst();
    }

    @Override
    public Optional<CronJob> findCronJob(String name) {
        return cronJobs.stream().filter(j -> j.getName().equals(name)).findFirst();
    }

    @Override
    public List<WeiboJob> weiboJobs() {
        return List.copyOf(weiboJobs);
    }

    @Override
    public List<CronJob> cronJobs() {
        return List.copyOf(cronJobs);
    }

    /** 스케줄 식이 잘못되면 로그만 남기고 타이머 실행에서 제외 (HTTP 경로는 유지) */
    private void addEntry(String kind, String name, String schedule, Runnable action) {
        Trigger trigger;
        try {
            trigger = ScheduleTriggers.parse(schedule, zone);
        } catch (IllegalArgumentException e) {
            log.error("add {} job {} error, invalid schedule '{}': {} [{}]",
                    kind, name, schedule, e.getMessage(), props.getAppName());
            return;
        }
        entries.add(new Entry(trigger, action));
        log.debug("added {} job {} as {} [{}]", kind, name, schedule, props.getAppName());
    }

    private void logResult(ExecutionResult result) {
        if (result.isSuccess()) {
            log.info("weibo job {} done: {}", result.getJobName(), result.getWeiboUrl());
        } else {
            log.error("weibo job {} failed: {}", result.getJobName(), result.getError());
        }
    }

    private void checkNotStarted() {
        if (started) {
            throw new IllegalStateException("jobs must be registered before start");
        }
    }

    private static class Entry {
        private final Trigger trigger;
        private final Runnable action;

        private Entry(Trigger trigger, Runnable action) {
            this.trigger = trigger;
            this.action = action;
        }
    }
}
