package net.crontide.integration.spring.cron;

import net.crontide.core.model.CronMacro;
import net.crontide.core.model.JitterOptions;
import net.crontide.core.service.CronEngine;
import net.crontide.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

/**
 * 내장 엔진을 쓰는 SPI 구현체 (best-effort, 예외 없음).
 * <p>
 * zone 을 엔진의 로컬 프레임으로 두고 계산하므로 결과는 실제 시각(UTC 기준 Instant)이다.
 * 커서 전진용이라 from 이 이미 일치하는 분이어도 다음 분부터 찾는다.
 */
public final class EngineCronCalculator implements CronCalculator {
    private final CronEngine engine;
    private final JitterOptions jitter;   // nullable

    public EngineCronCalculator(CronEngine engine) {
        this(engine, null);
    }

    public EngineCronCalculator(CronEngine engine, JitterOptions jitter) {
        this.engine = engine;
        this.jitter = jitter;
    }

    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) {
        Instant base = CronMacro.looksLikeMacro(cronExpr)
                ? from
                : from.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
        return engine.withLocalZone(zone).getNextExecutionTime(cronExpr, base, null, jitter);
    }
}
