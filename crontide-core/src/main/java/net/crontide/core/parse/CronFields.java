package net.crontide.core.parse;

import net.crontide.core.model.CronField;

import java.util.Optional;

/**
 * 공백으로 나눈 표준 표현식의 토큰들. 6번째(초) 토큰은 보관만 하고 해석하지 않는다.
 */
public record CronFields(
        String minute,
        String hour,
        String dayOfMonth,
        String month,
        String dayOfWeek,
        String seconds      // nullable
) {

    /** 5개 또는 6개 토큰이 아니면 empty */
    public static Optional<CronFields> split(String expression) {
        if (expression == null || expression.isBlank()) return Optional.empty();
        String[] p = expression.trim().split("\\s+");
        if (p.length != 5 && p.length != 6) return Optional.empty();
        return Optional.of(new CronFields(p[0], p[1], p[2], p[3], p[4], p.length == 6 ? p[5] : null));
    }

    public String token(CronField field) {
        return switch (field) {
            case MINUTE -> minute;
            case HOUR -> hour;
            case DAY_OF_MONTH -> dayOfMonth;
            case MONTH -> month;
            case DAY_OF_WEEK -> dayOfWeek;
        };
    }

    public boolean isWildcard(CronField field) {
        return CronField.isWildcard(token(field));
    }
}
