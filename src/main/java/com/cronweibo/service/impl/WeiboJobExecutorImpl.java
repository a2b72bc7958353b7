package com.cronweibo.service.impl;

import com.cronweibo.client.WeiboClient;
import com.cronweibo.config.CronweiboProperties;
import com.cronweibo.entity.CronJob;
import com.cronweibo.entity.ExecutionResult;
import com.cronweibo.entity.ShareResponse;
import com.cronweibo.entity.WeiboContent;
import com.cronweibo.entity.WeiboJob;
import com.cronweibo.service.TokenService;
import com.cronweibo.service.WeiboJobExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Slf4j
@Service("WeiboJobExecutor")
public class WeiboJobExecutorImpl implements WeiboJobExecutor {

    private final TokenService tokenService;
    private final WeiboClient weiboClient;
    private final CronweiboProperties props;

    public WeiboJobExecutorImpl(TokenService tokenService, WeiboClient weiboClient, CronweiboProperties props) {
        this.tokenService = tokenService;
        this.weiboClient = weiboClient;
        this.props = props;
    }

    @Override
    public ExecutionResult execute(WeiboJob job) {
        String appName = props.getAppName();
        log.info("doing weibo job: {} [{}]", job.getName(), appName);

        // 1) 작업 함수로 게시 내용 생성
        WeiboContent content;
        try {
            content = job.getRun().produce();
        } catch (RuntimeException e) {
            log.error("produce content error for job {} [{}]", job.getName(), appName, e);
            return ExecutionResult.failed(job.getName(), 0, "produce content error: " + e.getMessage());
        }
        if (content == null) {
            content = WeiboContent.text("");
        }

        // 2) 안전 링크 보강
        String text = augment(content.getText());

        // 3) 게시 직전 토큰 확인. 실패하면 이번 실행은 게시하지 않음
        try {
            tokenService.ensureValid();
        } catch (RuntimeException e) {
            log.error("update token error for job {} [{}]", job.getName(), appName, e);
            return ExecutionResult.failed(job.getName(), 0, "update token error: " + e.getMessage());
        }

        // 4) 게시 (최대 retry.count + 1 회)
        int maxAttempts = props.getRetry().getCount() + 1;
        Duration interval = props.getRetry().getInterval();
        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                ShareResponse resp = weiboClient.statusesShare(
                        tokenService.currentToken().getAccessToken(), text, content.getPic());
                log.info("weibo job {} published on attempt {}/{}: {} [{}]",
                        job.getName(), attempt, maxAttempts, resp, appName);
                return ExecutionResult.published(job.getName(), attempt, resp.weiboUrl());
            } catch (RuntimeException e) {
                lastError = e.getMessage();
                log.warn("statuses share error for job {} attempt {}/{}: {} [{}]",
                        job.getName(), attempt, maxAttempts, e.toString(), appName);
            }
            if (attempt < maxAttempts && !sleep(interval)) {
                log.warn("weibo job {} retry interrupted after attempt {} [{}]", job.getName(), attempt, appName);
                return ExecutionResult.failed(job.getName(), attempt, lastError);
            }
        }
        log.error("weibo job {} failed after {} attempts: {} [{}]", job.getName(), maxAttempts, lastError, appName);
        return ExecutionResult.failed(job.getName(), maxAttempts, lastError);
    }

    @Override
    public ExecutionResult execute(CronJob job) {
        log.info("doing cron job: {} [{}]", job.getName(), props.getAppName());
        try {
            job.getRun().run();
        } catch (RuntimeException e) {
            log.error("cron job {} error [{}]", job.getName(), props.getAppName(), e);
            return ExecutionResult.failed(job.getName(), 0, e.getMessage());
        }
        return ExecutionResult.done(job.getName());
    }

    @Override
    public String augment(String text) {
        String securityUrl = props.getWeibo().getSecurityUrl();
        String body = text == null ? "" : text;
        if (body.contains(securityUrl)) {
            return body;
        }
        return body + "\n" + securityUrl;
    }

    /** @return 인터럽트 없이 대기를 마쳤으면 true */
    private static boolean sleep(Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(interval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
