package com.cronweibo.schedule;

import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.ZoneId;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 스케줄 문자열을 Spring {@link Trigger} 로 변환합니다.
 * <ul>
 *   <li>6필드 cron 식 (초 분 시 일 월 요일)</li>
 *   <li>@yearly, @annually, @monthly, @weekly, @daily, @midnight, @hourly</li>
 *   <li>@every &lt;duration&gt; (ex. 90s, 2m, 1h30m). 첫 실행은 한 주기 뒤</li>
 * </ul>
 */
public final class ScheduleTriggers {

    private static final String EVERY = "@every ";
    private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");

    private ScheduleTriggers() {
    }

    /**
     * @throws IllegalArgumentException 해석할 수 없는 식
     */
    public static Trigger parse(String schedule, ZoneId zone) {
        if (schedule == null || schedule.isBlank()) {
            throw new IllegalArgumentException("empty schedule expression");
        }
        String expr = schedule.trim();
        if (expr.startsWith(EVERY)) {
            Duration period = parseDuration(expr.substring(EVERY.length()).trim());
            PeriodicTrigger trigger = new PeriodicTrigger(period);
            trigger.setFixedRate(true);
            trigger.setInitialDelay(period);
            return trigger;
        }
        // 매크로(@daily 등)는 CronExpression 이 직접 지원
        return new CronTrigger(expr, zone);
    }

    /** "1h30m", "2m", "500ms" 형식의 기간 */
    public static Duration parseDuration(String text) {
        Matcher m = DURATION_PART.matcher(text);
        BigDecimal nanos = BigDecimal.ZERO;
        int pos = 0;
        while (pos < text.length()) {
            if (!m.find(pos) || m.start() != pos) {
                throw new IllegalArgumentException("invalid duration: " + text);
            }
            nanos = nanos.add(new BigDecimal(m.group(1)).multiply(BigDecimal.valueOf(unitNanos(m.group(2)))));
            pos = m.end();
        }
        if (pos == 0 || nanos.signum() <= 0) {
            throw new IllegalArgumentException("duration must be positive: " + text);
        }
        try {
            return Duration.ofNanos(nanos.setScale(0, RoundingMode.DOWN).longValueExact());
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("duration out of range: " + text, e);
        }
    }

    private static long unitNanos(String unit) {
        switch (unit) {
            case "ns":
                return 1L;
            case "us":
            case "µs":
                return 1_000L;
            case "ms":
                return 1_000_000L;
            case "s":
                return 1_000_000_000L;
            case "m":
                return 60_000_000_000L;
            default:
                return 3_600_000_000_000L;
        }
    }
}
