package net.crontide.core.model;

import java.time.Duration;
import java.time.Instant;

public record SchedulePlan(
        String id,
        String effectiveExpression,
        boolean defaulted,        // 누락/무효로 기본 스케줄이 적용되었는지
        long intervalMs,
        Instant nextFireAt,
        Duration delay            // now 기준, 음수는 0으로 보정
) {
}
