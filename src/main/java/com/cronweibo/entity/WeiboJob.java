package com.cronweibo.entity;

import com.cronweibo.service.WeiboJobFunc;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 웨이보 작업 = 작업 이름 + 스케줄 식 + 작업 함수.
 * 이름은 HTTP 경로(/weibo/이름)로도 쓰입니다.
 *
 * <pre>
 * 스케줄 예시
 * 0 *&#47;2 * * * *   2분마다
 * &#64;daily            매일 자정
 * &#64;every 1h30m      90분마다
 * </pre>
 */
@Getter
@ToString
public class WeiboJob {

    private final String name;
    private final String schedule;
    @ToString.Exclude
    private final WeiboJobFunc run;

    public WeiboJob(String name, String schedule, WeiboJobFunc run) {
        this.name = Objects.requireNonNull(name, "name");
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.run = Objects.requireNonNull(run, "run");
    }
}
