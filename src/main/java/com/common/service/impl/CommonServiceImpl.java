package com.common.service.impl;

import com.common.service.CommonService;
import com.cronweibo.entity.CronJob;
import com.cronweibo.entity.ExecutionResult;
import com.cronweibo.entity.WeiboJob;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.List;

@Service("CommonService")
public class CommonServiceImpl implements CommonService {

    public String formatWeiboJobResult(String appName, ExecutionResult r) {
        if (!r.isSuccess()) {
            return "<p>" + esc(appName) + " weibo 작업: " + esc(r.getJobName())
                    + " 실패. " + esc(r.getError()) + "</p>";
        }
        String url = esc(r.getWeiboUrl());
        return "<p>" + esc(appName) + " weibo 작업: " + esc(r.getJobName())
                + " 실행 완료. <a href=\"" + url + "\">" + url + "</a> 에서 확인하세요</p>";
    }

    public String formatCronJobResult(String appName, ExecutionResult r) {
        if (!r.isSuccess()) {
            return "<p>" + esc(appName) + " cron 작업: " + esc(r.getJobName())
                    + " 실패. " + esc(r.getError()) + "</p>";
        }
        return "<p>" + esc(appName) + " cron 작업: " + esc(r.getJobName()) + " 실행 완료.</p>";
    }

    public String formatIndexPage(String appName, List<WeiboJob> weiboJobs, List<CronJob> cronJobs) {
        StringBuilder sb = new StringBuilder();
        sb.append("<!DOCTYPE html><html><head><meta charset=\"utf-8\"><title>")
                .append(esc(appName)).append("</title></head><body>");

        // 1) 웨이보 작업 목록
        sb.append("<h3>weibo 작업</h3><ul>");
        for (WeiboJob job : weiboJobs) {
            sb.append(listItem("/weibo/", job.getName()));
        }
        sb.append("</ul>");

        // 2) 일반 작업 목록
        sb.append("<h3>cron 작업</h3><ul>");
        for (CronJob job : cronJobs) {
            sb.append(listItem("/cron/", job.getName()));
        }
        sb.append("</ul></body></html>");
        return sb.toString();
    }

    private static String listItem(String prefix, String name) {
        String href = prefix + UriUtils.encodePathSegment(name, StandardCharsets.UTF_8);
        return "<li><a href=\"" + esc(href) + "\" target=\"blank\">" + esc(name) + "</a></li>";
    }

    private static String esc(String s) {
        return s == null ? "" : HtmlUtils.htmlEscape(s);
    }
}
