package net.crontide.core.service;

import net.crontide.core.model.CronField;
import net.crontide.core.model.CronMacro;
import net.crontide.core.model.JitterOptions;
import net.crontide.core.parse.CronFields;
import net.crontide.core.parse.FieldParser;
import net.crontide.core.spi.EngineLogger;

import java.time.Duration;
import java.util.SortedSet;

/**
 * 표현식이 "대략 얼마나 자주" 도는지 밀리초로 추정한다.
 * 폴링 주기 결정용 근사치이며 정확한 정렬(alignment)에는 쓰지 않는다.
 */
public final class IntervalEstimator {
    private static final long MINUTE = Duration.ofMinutes(1).toMillis();
    private static final long HOUR = Duration.ofHours(1).toMillis();
    private static final long DAY = Duration.ofDays(1).toMillis();

    private final JitterApplier jitter;
    private final EngineLogger log;

    public IntervalEstimator(JitterApplier jitter, EngineLogger log) {
        this.jitter = jitter;
        this.log = log;
    }

    public long estimateMillis(String expression, JitterOptions options) {
        return jitter.apply(rawMillis(expression), options);
    }

    long rawMillis(String expression) {
        var macro = CronMacro.find(expression);
        if (macro.isPresent()) return macro.get().intervalMillis();

        var parts = CronFields.split(expression);
        if (parts.isEmpty()) {
            log.warn("Invalid cron expression: " + expression + ", falling back to hourly");
            return CronMacro.HOURLY.intervalMillis();
        }
        return fromFields(parts.get());
    }

    /** 위에서부터 처음 맞는 규칙이 이긴다 */
    static long fromFields(CronFields f) {
        // 분: */n
        int minuteStep = stepOf(f.minute(), CronField.MINUTE);
        if (minuteStep > 0) return minuteStep * MINUTE;

        if (!f.isWildcard(CronField.MINUTE)) {
            SortedSet<Integer> minutes = FieldParser.parseField(f.minute(), CronField.MINUTE);
            if (minutes.size() >= 2) return minGap(minutes, 60) * MINUTE;
            return f.isWildcard(CronField.HOUR) ? HOUR : DAY;
        }

        int hourStep = stepOf(f.hour(), CronField.HOUR);
        if (hourStep > 0) return hourStep * HOUR;

        if (!f.isWildcard(CronField.HOUR)) {
            SortedSet<Integer> hours = FieldParser.parseField(f.hour(), CronField.HOUR);
            if (hours.size() >= 2) return minGap(hours, 24) * HOUR;
            return dayInterval(f, DAY);
        }

        if (!f.isWildcard(CronField.DAY_OF_MONTH) || !f.isWildcard(CronField.DAY_OF_WEEK)) {
            return dayInterval(f, DAY);
        }
        if (!f.isWildcard(CronField.MONTH)) {
            return 365 * DAY;
        }
        return MINUTE;
    }

    /** 일만 지정 → 30일, 요일이 지정되면 → 7일, 둘 다 * 면 fallback */
    private static long dayInterval(CronFields f, long fallback) {
        boolean dom = !f.isWildcard(CronField.DAY_OF_MONTH);
        boolean dow = !f.isWildcard(CronField.DAY_OF_WEEK);
        if (dom && !dow) return 30 * DAY;
        if (dow) return 7 * DAY;
        return fallback;
    }

    // "*/n" 꼴이고 1 <= n <= max 면 n, 아니면 0
    private static int stepOf(String token, CronField field) {
        if (!token.startsWith("*/")) return 0;
        int n = FieldParser.parseNumber(token.substring(2));
        return n > 0 && n <= field.max() ? n : 0;
    }

    /** 정렬된 값들 사이 최소 간격. 마지막 값 → 다음 주기의 첫 값까지도 본다 */
    static long minGap(SortedSet<Integer> values, int period) {
        int min = period;
        Integer prev = null;
        for (int v : values) {
            if (prev != null) min = Math.min(min, v - prev);
            prev = v;
        }
        min = Math.min(min, period - values.last() + values.first());
        return min;
    }
}
