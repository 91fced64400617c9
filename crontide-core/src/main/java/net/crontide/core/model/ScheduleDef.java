package net.crontide.core.model;

/** 호출자가 넘기는 스케줄 정의. expression 이 null/blank 면 기본 스케줄로 대체된다 */
public record ScheduleDef(
        String id,
        String expression,
        TimezoneInfo timezone,   // nullable
        JitterOptions jitter     // nullable
) {
    public static ScheduleDef of(String id, String expression) {
        return new ScheduleDef(id, expression, null, null);
    }
}
