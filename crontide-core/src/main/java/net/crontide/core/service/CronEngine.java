package net.crontide.core.service;

import net.crontide.core.model.JitterOptions;
import net.crontide.core.model.TimezoneInfo;
import net.crontide.core.parse.CronSyntaxValidator;
import net.crontide.core.parse.FieldParser;
import net.crontide.core.spi.Clock;
import net.crontide.core.spi.EngineLogger;
import net.crontide.core.spi.RandomSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.SortedSet;

/**
 * 스케줄 엔진 진입점. 상태가 없어 여러 스레드에서 공유해도 된다.
 * <ul>
 *   <li>{@link #isValidCronExpression(String)}: 구조 검사 (fail-closed)</li>
 *   <li>{@link #parseCronToMs(String, JitterOptions)}: 대략적인 주기</li>
 *   <li>{@link #getNextExecutionTime(String, Instant, TimezoneInfo, JitterOptions)}: 다음 실행 시각</li>
 *   <li>{@link #parseField(String, int, int)}: 필드 하나를 값 집합으로 (fail-open)</li>
 * </ul>
 */
public final class CronEngine {
    private final IntervalEstimator estimator;
    private final NextExecutionCalculator calculator;
    private final JitterApplier jitter;
    private final EngineLogger logger;
    private final RandomSource random;
    private final Clock clock;

    private CronEngine(Builder b) {
        this.logger = b.logger;
        this.random = b.random;
        this.clock = b.clock;
        this.jitter = new JitterApplier(random);
        this.estimator = new IntervalEstimator(jitter, logger);
        this.calculator = new NextExecutionCalculator(estimator, jitter, logger, b.localZone);
    }

    public static CronEngine defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isValidCronExpression(String expression) {
        return CronSyntaxValidator.isValid(expression);
    }

    public long parseCronToMs(String expression) {
        return parseCronToMs(expression, null);
    }

    public long parseCronToMs(String expression, JitterOptions jitter) {
        return estimator.estimateMillis(expression, jitter);
    }

    /** 기준 시각은 주입된 Clock */
    public Instant getNextExecutionTime(String expression) {
        return getNextExecutionTime(expression, clock.now(), null, null);
    }

    public Instant getNextExecutionTime(String expression, Instant baseTime) {
        return getNextExecutionTime(expression, baseTime, null, null);
    }

    public Instant getNextExecutionTime(String expression, Instant baseTime, TimezoneInfo timezone) {
        return getNextExecutionTime(expression, baseTime, timezone, null);
    }

    public Instant getNextExecutionTime(String expression, Instant baseTime,
                                        TimezoneInfo timezone, JitterOptions jitter) {
        return calculator.next(expression, baseTime, timezone, jitter);
    }

    public SortedSet<Integer> parseField(String field, int min, int max) {
        return FieldParser.parseField(field, min, max);
    }

    public long applyJitter(long baseMs, JitterOptions options) {
        return jitter.apply(baseMs, options);
    }

    public ZoneId localZone() {
        return calculator.localZone();
    }

    public Clock clock() {
        return clock;
    }

    /** 로거/난수/시계는 그대로 두고 로컬 프레임만 바꾼 엔진 */
    public CronEngine withLocalZone(ZoneId zone) {
        if (zone.equals(localZone())) return this;
        return builder().logger(logger).random(random).clock(clock).localZone(zone).build();
    }

    public static final class Builder {
        private EngineLogger logger = EngineLogger.slf4j(CronEngine.class);
        private RandomSource random = RandomSource.threadLocal();
        private ZoneId localZone = ZoneOffset.UTC;
        private Clock clock = Clock.system();

        private Builder() { }

        public Builder logger(EngineLogger logger) {
            this.logger = Objects.requireNonNull(logger, "logger");
            return this;
        }

        public Builder random(RandomSource random) {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        /** 필드 비교에 쓰는 로컬 프레임. 기본 UTC */
        public Builder localZone(ZoneId localZone) {
            this.localZone = Objects.requireNonNull(localZone, "localZone");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public CronEngine build() {
            return new CronEngine(this);
        }
    }
}
