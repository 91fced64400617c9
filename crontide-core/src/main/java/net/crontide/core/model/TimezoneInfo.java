package net.crontide.core.model;

/**
 * 고정 오프셋 타임존. name은 표시용이고 계산에는 offsetMinutes만 쓴다.
 * DST나 타임존 DB는 지원하지 않는다.
 */
public record TimezoneInfo(String name, int offsetMinutes) {

    public static TimezoneInfo fixed(String name, int offsetMinutes) {
        return new TimezoneInfo(name, offsetMinutes);
    }
}
