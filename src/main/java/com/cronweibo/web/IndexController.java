package com.cronweibo.web;

import com.common.service.CommonService;
import com.cronweibo.config.CronweiboProperties;
import com.cronweibo.service.JobRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** 등록된 작업 목록 페이지 */
@Tag(name = "CronWeibo", description = "작업 수동 실행 API")
@RestController
@ConditionalOnWebApplication
public class IndexController {

    private final JobRegistry registry;
    private final CommonService commonService;
    private final CronweiboProperties props;

    public IndexController(JobRegistry registry, CommonService commonService, CronweiboProperties props) {
        this.registry = registry;
        this.commonService = commonService;
        this.props = props;
    }

    @Operation(summary = "작업 목록", description = "등록된 weibo/cron 작업의 실행 링크 목록을 반환합니다.")
    @GetMapping("/")
    public ResponseEntity<String> index() {
        String page = commonService.formatIndexPage(props.getAppName(), registry.weiboJobs(), registry.cronJobs());
        return ResponseEntity.ok().contentType(MediaType.parseMediaType("text/html;charset=UTF-8")).body(page);
    }
}
