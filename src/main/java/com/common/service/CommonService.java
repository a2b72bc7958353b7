package com.common.service;

import com.cronweibo.entity.CronJob;
import com.cronweibo.entity.ExecutionResult;
import com.cronweibo.entity.WeiboJob;

import java.util.List;

/**
 * HTTP 응답용 HTML 조각을 만드는 공통 서비스입니다.
 * 목록 페이지는 요청 시점의 작업 스냅샷으로 매번 새로 그립니다.
 */
public interface CommonService {

    /** 웨이보 작업 실행 결과 (성공 시 게시물 링크, 실패 시 오류 문구) */
    String formatWeiboJobResult(String appName, ExecutionResult result);

    /** 일반 작업 실행 완료 문구 */
    String formatCronJobResult(String appName, ExecutionResult result);

    /** 등록된 작업 목록 페이지 */
    String formatIndexPage(String appName, List<WeiboJob> weiboJobs, List<CronJob> cronJobs);
}
