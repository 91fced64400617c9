package net.crontide.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** 이름 있는 단축 표현. 간격은 월/윤년 차이를 무시한 평탄 근사값(30일, 365일) */
public enum CronMacro {
    YEARLY(Duration.ofDays(365), "0 0 1 1 *", "@yearly", "@annually"),
    MONTHLY(Duration.ofDays(30), "0 0 1 * *", "@monthly"),
    WEEKLY(Duration.ofDays(7), "0 0 * * 0", "@weekly"),
    DAILY(Duration.ofHours(24), "0 0 * * *", "@daily", "@midnight"),
    HOURLY(Duration.ofHours(1), "0 * * * *", "@hourly"),
    EVERY_MINUTE(Duration.ofMinutes(1), "* * * * *", "@every_minute"),
    EVERY_5_MINUTES(Duration.ofMinutes(5), "*/5 * * * *", "@every_5_minutes"),
    EVERY_10_MINUTES(Duration.ofMinutes(10), "*/10 * * * *", "@every_10_minutes"),
    EVERY_15_MINUTES(Duration.ofMinutes(15), "*/15 * * * *", "@every_15_minutes"),
    EVERY_30_MINUTES(Duration.ofMinutes(30), "*/30 * * * *", "@every_30_minutes");

    private final Duration interval;
    private final String fiveField;
    private final List<String> aliases;

    CronMacro(Duration interval, String fiveField, String... aliases) {
        this.interval = interval;
        this.fiveField = fiveField;
        this.aliases = List.of(aliases);
    }

    public long intervalMillis() { return interval.toMillis(); }
    public String fiveField() { return fiveField; }
    public List<String> aliases() { return aliases; }
    public String canonicalName() { return aliases.get(0); }

    /** 대소문자 무시. 앞뒤 공백은 허용하지 않는다 */
    public static Optional<CronMacro> find(String expression) {
        if (expression == null) return Optional.empty();
        String key = expression.toLowerCase(Locale.ROOT);
        for (CronMacro m : values()) {
            if (m.aliases.contains(key)) return Optional.of(m);
        }
        return Optional.empty();
    }

    public static boolean looksLikeMacro(String expression) {
        return expression != null && expression.startsWith("@");
    }
}
