package net.crontide.core.service;

import net.crontide.core.model.CronMacro;
import net.crontide.core.model.JitterOptions;
import net.crontide.core.model.TimezoneInfo;
import net.crontide.core.parse.CompiledCron;
import net.crontide.core.parse.CronFields;
import net.crontide.core.spi.EngineLogger;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * 기준 시각 이후 표현식과 맞는 첫 분(minute)을 1분씩 전진하며 찾는다.
 * <p>
 * 잘못된 표현식에도 예외를 던지지 않는다. 필드 수가 틀리면 @hourly, 탐색이
 * {@link #MAX_ITERATIONS}번 안에 끝나지 않으면 간격 추정치로 대체한다.
 * 타임존이 주어지면 결과는 요청 타임존의 벽시계와 바로 비교할 수 있는 (이동된) 프레임의 시각이다.
 */
public final class NextExecutionCalculator {
    public static final int MAX_ITERATIONS = 1000;

    private final IntervalEstimator estimator;
    private final JitterApplier jitter;
    private final EngineLogger log;
    private final ZoneId localZone;

    public NextExecutionCalculator(IntervalEstimator estimator,
                                   JitterApplier jitter,
                                   EngineLogger log,
                                   ZoneId localZone) {
        this.estimator = estimator;
        this.jitter = jitter;
        this.log = log;
        this.localZone = localZone;
    }

    public Instant next(String expression, Instant baseTime, TimezoneInfo timezone, JitterOptions options) {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(baseTime, "baseTime");

        // 1) 매크로는 필드 탐색 없이 base + 간격
        if (CronMacro.looksLikeMacro(expression)) {
            return baseTime.plusMillis(estimator.estimateMillis(expression, options));
        }

        // 2) 필드 수 검사
        var parts = CronFields.split(expression);
        if (parts.isEmpty()) {
            log.warn("Invalid cron expression: " + expression + ", falling back to hourly");
            return baseTime.plusMillis(estimator.estimateMillis(CronMacro.HOURLY.canonicalName(), options));
        }

        // 3) 타임존 이동, 4) 필드 펼치기
        Instant adjusted = shift(baseTime, timezone);
        CompiledCron cron = CompiledCron.compile(parts.get());

        // 5~7) 분 단위 전진 탐색
        ZonedDateTime candidate = adjusted.atZone(localZone).truncatedTo(ChronoUnit.MINUTES);
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            if (cron.matches(candidate)) {
                return withJitter(baseTime, candidate.toInstant(), options);
            }
            candidate = candidate.plusMinutes(1);
        }

        // 8) 탐색 한도 초과
        log.warn("Could not find next execution time for cron expression: " + expression
                + ", falling back to interval-based calculation");
        return baseTime.plusMillis(estimator.estimateMillis(expression, options));
    }

    /**
     * base + (로컬 오프셋 + 요청 오프셋). 로컬 오프셋은 UTC 대비 "뒤처진" 분(UTC+9 → -540).
     */
    Instant shift(Instant baseTime, TimezoneInfo timezone) {
        if (timezone == null) return baseTime;
        int localOffsetMinutes = -localZone.getRules().getOffset(baseTime).getTotalSeconds() / 60;
        long offsetDiff = (long) localOffsetMinutes + timezone.offsetMinutes();
        return baseTime.plus(offsetDiff, ChronoUnit.MINUTES);
    }

    // 9) 지터는 원래 base 와 찾은 시각 사이 간격에 적용
    private Instant withJitter(Instant baseTime, Instant found, JitterOptions options) {
        if (!JitterOptions.isActive(options)) return found;
        long gap = found.toEpochMilli() - baseTime.toEpochMilli();
        return baseTime.plusMillis(jitter.apply(gap, options));
    }

    public ZoneId localZone() {
        return localZone;
    }
}
