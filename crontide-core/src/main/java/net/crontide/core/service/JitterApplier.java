package net.crontide.core.service;

import net.crontide.core.model.JitterOptions;
import net.crontide.core.spi.RandomSource;

import java.util.Objects;

/** 간격을 무작위 비율만큼 줄인다. 결과는 항상 baseMs 이하 */
public final class JitterApplier {
    private final RandomSource random;

    public JitterApplier(RandomSource random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public long apply(long baseMs, JitterOptions options) {
        // 0 이하 간격은 줄일 것이 없다
        if (!JitterOptions.isActive(options) || baseMs <= 0) {
            return baseMs;
        }
        double draw = Math.min(Math.max(random.nextDouble(), 0), 1);
        double amount = baseMs * options.clampedPercent() * draw;
        return baseMs - (long) amount;
    }
}
