package net.crontide.core.spi;

import java.time.Instant;
import java.time.ZoneId;

/** 다음 실행 시각 계산 SPI. 구현체는 integration 모듈에서 제공 */
public interface CronCalculator {
    Instant next(Instant from, String cronExpr, ZoneId zone);
}
