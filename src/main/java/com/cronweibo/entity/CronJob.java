package com.cronweibo.entity;

import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 게시 단계가 없는 일반 cron 작업입니다.
 * 실패 처리는 작업 자신이 책임집니다. HTTP 경로는 /cron/이름 입니다.
 */
@Getter
@ToString
public class CronJob {

    private final String name;
    private final String schedule;
    @ToString.Exclude
    private final Runnable run;

    public CronJob(String name, String schedule, Runnable run) {
        this.name = Objects.requireNonNull(name, "name");
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.run = Objects.requireNonNull(run, "run");
    }
}
