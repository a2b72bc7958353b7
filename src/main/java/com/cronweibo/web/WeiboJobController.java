package com.cronweibo.web;

import com.common.service.CommonService;
import com.cronweibo.config.CronweiboProperties;
import com.cronweibo.entity.CronJob;
import com.cronweibo.entity.ExecutionResult;
import com.cronweibo.entity.WeiboJob;
import com.cronweibo.service.JobRegistry;
import com.cronweibo.service.WeiboJobExecutor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.HtmlUtils;

import java.util.Optional;

/**
 * 등록된 작업을 수동으로 실행하는 컨트롤러 계층입니다.
 * - GET /weibo/{name} : 웨이보 작업 실행 (스케줄러와 같은 파이프라인)
 * - GET /cron/{name}  : 일반 작업 실행
 * 요청 스레드에서 동기로 실행하고 결과를 HTML 조각으로 돌려줍니다.
 */
@Slf4j
@Tag(name = "CronWeibo", description = "작업 수동 실행 API")
@RestController
@ConditionalOnWebApplication
public class WeiboJobController {

    private static final MediaType TEXT_HTML_UTF8 = MediaType.parseMediaType("text/html;charset=UTF-8");

    private final JobRegistry registry;
    private final WeiboJobExecutor executor;
    private final CommonService commonService;
    private final CronweiboProperties props;

    public WeiboJobController(JobRegistry registry, WeiboJobExecutor executor,
                              CommonService commonService, CronweiboProperties props) {
        this.registry = registry;
        this.executor = executor;
        this.commonService = commonService;
        this.props = props;
    }

    @Operation(summary = "웨이보 작업 즉시 실행", description = "내용 생성 후 웨이보에 게시하고 게시물 링크를 반환합니다.")
    @GetMapping("/weibo/{name}")
    public ResponseEntity<String> runWeiboJob(@PathVariable String name, HttpServletRequest request) {
        Optional<WeiboJob> job = registry.findWeiboJob(name);
        if (job.isEmpty()) {
            return notFound("weibo", name);
        }
        log.info("handler weibo job {} run by {} [{}]", name, request.getRemoteAddr(), props.getAppName());
        ExecutionResult result = executor.execute(job.get());
        log.info("handler weibo job {} done, success={} [{}]", name, result.isSuccess(), props.getAppName());
        return html(commonService.formatWeiboJobResult(props.getAppName(), result));
    }

    @Operation(summary = "cron 작업 즉시 실행", description = "게시 단계가 없는 일반 작업을 실행합니다.")
    @GetMapping("/cron/{name}")
    public ResponseEntity<String> runCronJob(@PathVariable String name, HttpServletRequest request) {
        Optional<CronJob> job = registry.findCronJob(name);
        if (job.isEmpty()) {
            return notFound("cron", name);
        }
        log.info("handler cron job {} run by {} [{}]", name, request.getRemoteAddr(), props.getAppName());
        ExecutionResult result = executor.execute(job.get());
        log.info("handler cron job {} done [{}]", name, props.getAppName());
        return html(commonService.formatCronJobResult(props.getAppName(), result));
    }

    private static ResponseEntity<String> html(String body) {
        return ResponseEntity.ok().contentType(TEXT_HTML_UTF8).body(body + "\n");
    }

    private static ResponseEntity<String> notFound(String kind, String name) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).contentType(TEXT_HTML_UTF8)
                .body("<p>" + kind + " 작업을 찾을 수 없습니다: " + HtmlUtils.htmlEscape(name) + "</p>\n");
    }
}
