package net.crontide.core.parse;

import net.crontide.core.model.CronField;
import net.crontide.core.model.CronMacro;

/**
 * 표현식의 구조만 빠르게 검사한다. 값 집합은 만들지 않는다.
 * <p>
 * {@link FieldParser}와 문법은 같지만 잘못된 토큰을 전체 범위로 대체하지 않고 바로 실패시킨다(fail-closed).
 */
public final class CronSyntaxValidator {

    private CronSyntaxValidator() { }

    public static boolean isValid(String expression) {
        if (expression == null) return false;
        if (CronMacro.find(expression).isPresent()) return true;

        var parts = CronFields.split(expression);
        if (parts.isEmpty()) return false;

        CronFields f = parts.get();
        for (CronField field : CronField.values()) {
            if (!isValidPart(f.token(field), field.min(), field.max())) return false;
        }
        return true;
    }

    static boolean isValidPart(String part, int min, int max) {
        if (CronField.isWildcard(part)) return true;

        if (part.startsWith("*/")) {
            int interval = FieldParser.parseNumber(part.substring(2));
            return interval > 0 && interval <= max;
        }

        if (part.indexOf(',') >= 0) {
            for (String value : part.split(",", -1)) {
                if (!isValidPart(value, min, max)) return false;
            }
            return true;
        }

        if (part.indexOf('-') >= 0) {
            int slash = part.indexOf('/');
            if (slash >= 0) {
                int step = FieldParser.parseNumber(part.substring(slash + 1));
                if (step <= 0 || step > max) return false;
            }
            return FieldParser.parseRange(part, min, max) != null;
        }

        int value = FieldParser.parseNumber(part);
        return value >= min && value <= max;
    }
}
