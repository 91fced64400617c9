package net.crontide.core.parse;

import net.crontide.core.model.CronField;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 필드 하나를 값 집합으로 펼친다.
 * <p>
 * 런타임 경로용이라 해석할 수 없는 토큰은 예외 대신 전체 범위({@code [min, max]})로 대체한다(fail-open).
 * 엄격한 검사가 필요하면 {@link CronSyntaxValidator}를 먼저 쓴다.
 * 반환 집합은 오름차순, 중복 없음, 비어 있지 않음, 수정 불가.
 */
public final class FieldParser {

    private FieldParser() { }

    public static SortedSet<Integer> parseField(String field, CronField kind) {
        return parseField(field, kind.min(), kind.max());
    }

    public static SortedSet<Integer> parseField(String field, int min, int max) {
        if (field == null || CronField.isWildcard(field)) {
            return fullDomain(min, max);
        }

        // */n : n 이 잘못되면 * 로 취급
        if (field.startsWith("*/")) {
            int step = parseNumber(field.substring(2));
            return step > 0 ? stepped(min, max, step) : fullDomain(min, max);
        }

        // a-b, a-b/s : 범위를 벗어나면 다음 형태로 넘어간다
        if (field.indexOf('-') >= 0) {
            SortedSet<Integer> range = parseRange(field, min, max);
            if (range != null) return freeze(range);
        }

        if (field.indexOf(',') >= 0) {
            SortedSet<Integer> union = new TreeSet<>();
            for (String token : field.split(",", -1)) {
                SortedSet<Integer> part = parseListToken(token, min, max);
                if (part == null) {
                    // 토큰 하나라도 깨지면 필드 전체를 와일드카드로
                    return fullDomain(min, max);
                }
                union.addAll(part);
            }
            return freeze(union);
        }

        int value = parseNumber(field);
        if (value >= min && value <= max) {
            return freeze(new TreeSet<>(Collections.singleton(value)));
        }

        return fullDomain(min, max);
    }

    public static SortedSet<Integer> fullDomain(int min, int max) {
        return stepped(min, max, 1);
    }

    // 목록 원소: 와일드카드, 간격, 범위, 단일 값. 해석할 수 없으면 null
    private static SortedSet<Integer> parseListToken(String token, int min, int max) {
        if (CronField.isWildcard(token)) {
            return fullDomain(min, max);
        }
        if (token.startsWith("*/")) {
            int step = parseNumber(token.substring(2));
            return step > 0 ? stepped(min, max, step) : null;
        }
        if (token.indexOf('-') >= 0) {
            return parseRange(token, min, max);
        }
        int value = parseNumber(token);
        if (value < min || value > max) return null;
        SortedSet<Integer> single = new TreeSet<>();
        single.add(value);
        return single;
    }

    /** 유효하지 않으면 null */
    static SortedSet<Integer> parseRange(String token, int min, int max) {
        String rangePart = token;
        int step = 1;
        int slash = token.indexOf('/');
        if (slash >= 0) {
            rangePart = token.substring(0, slash);
            step = parseNumber(token.substring(slash + 1));
            if (step <= 0) return null;
        }
        String[] bounds = rangePart.split("-", -1);
        if (bounds.length != 2) return null;
        int start = parseNumber(bounds[0]);
        int end = parseNumber(bounds[1]);
        if (start < min || end > max || start > end) return null;

        SortedSet<Integer> out = new TreeSet<>();
        for (int v = start; v <= end; v += step) out.add(v);
        return out;
    }

    private static SortedSet<Integer> stepped(int min, int max, int step) {
        SortedSet<Integer> out = new TreeSet<>();
        for (int v = min; v <= max; v += step) out.add(v);
        return freeze(out);
    }

    private static SortedSet<Integer> freeze(SortedSet<Integer> values) {
        return Collections.unmodifiableSortedSet(values);
    }

    /**
     * 부호 없는 10진 정수. 숫자가 아니거나 비어 있거나 너무 길면 -1.
     */
    public static int parseNumber(String s) {
        if (s == null || s.isEmpty() || s.length() > 9) return -1;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') return -1;
        }
        return Integer.parseInt(s);
    }
}
