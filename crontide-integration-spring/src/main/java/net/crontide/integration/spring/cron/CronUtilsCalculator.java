package net.crontide.integration.spring.cron;

import net.crontide.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;

/** 엄격 모드 SPI 구현체. from 보다 엄격히 뒤의 시각을 돌려준다 */
public final class CronUtilsCalculator implements CronCalculator {
    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) {
        return CronSlotPlanner.compute(cronExpr, zone, from).nextUtc();
    }
}
