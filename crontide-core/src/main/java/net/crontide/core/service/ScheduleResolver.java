package net.crontide.core.service;

import net.crontide.core.model.CronMacro;
import net.crontide.core.model.ScheduleDef;
import net.crontide.core.model.SchedulePlan;
import net.crontide.core.spi.EngineLogger;

import java.time.Duration;
import java.time.Instant;

/**
 * 스케줄 정의 → 실행 계획. 누락되었거나 검증에 실패한 표현식은 @hourly 로 바꾸고 경고를 남긴다.
 */
public final class ScheduleResolver {
    public static final String DEFAULT_EXPRESSION = CronMacro.HOURLY.canonicalName();

    private final CronEngine engine;
    private final EngineLogger log;

    public ScheduleResolver(CronEngine engine, EngineLogger log) {
        this.engine = engine;
        this.log = log;
    }

    public SchedulePlan resolve(ScheduleDef def) {
        return resolve(def, engine.clock().now());
    }

    public SchedulePlan resolve(ScheduleDef def, Instant now) {
        String expr = def.expression();
        boolean defaulted = false;

        if (expr == null || expr.isBlank()) {
            log.warn("No schedule provided for: " + def.id() + ", using default hourly schedule");
            expr = DEFAULT_EXPRESSION;
            defaulted = true;
        } else if (!engine.isValidCronExpression(expr)) {
            log.warn("Invalid cron expression: " + expr + " for: " + def.id() + ", using default hourly schedule");
            expr = DEFAULT_EXPRESSION;
            defaulted = true;
        }

        long interval = engine.parseCronToMs(expr, def.jitter());
        Instant next = engine.getNextExecutionTime(expr, now, def.timezone(), def.jitter());
        Duration delay = Duration.between(now, next);
        if (delay.isNegative()) delay = Duration.ZERO;

        return new SchedulePlan(def.id(), expr, defaulted, interval, next, delay);
    }
}
