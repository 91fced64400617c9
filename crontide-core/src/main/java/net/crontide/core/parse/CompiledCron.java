package net.crontide.core.parse;

import net.crontide.core.model.CronField;

import java.time.ZonedDateTime;
import java.util.SortedSet;

/**
 * 다섯 필드를 값 집합으로 펼쳐 둔 것. 후보 시각 매칭에만 쓴다.
 * 일(day-of-month)과 요일(day-of-week)이 둘 다 명시되면 둘 중 하나만 맞아도 된다(OR).
 */
public record CompiledCron(
        SortedSet<Integer> minutes,
        SortedSet<Integer> hours,
        SortedSet<Integer> daysOfMonth,
        SortedSet<Integer> months,
        SortedSet<Integer> daysOfWeek,
        boolean dayOfMonthExplicit,
        boolean dayOfWeekExplicit
) {

    public static CompiledCron compile(CronFields f) {
        return new CompiledCron(
                FieldParser.parseField(f.minute(), CronField.MINUTE),
                FieldParser.parseField(f.hour(), CronField.HOUR),
                FieldParser.parseField(f.dayOfMonth(), CronField.DAY_OF_MONTH),
                FieldParser.parseField(f.month(), CronField.MONTH),
                FieldParser.parseField(f.dayOfWeek(), CronField.DAY_OF_WEEK),
                !f.isWildcard(CronField.DAY_OF_MONTH),
                !f.isWildcard(CronField.DAY_OF_WEEK));
    }

    public boolean matches(ZonedDateTime t) {
        return minutes.contains(t.getMinute())
                && hours.contains(t.getHour())
                && months.contains(t.getMonthValue())
                && dayMatches(t);
    }

    boolean dayMatches(ZonedDateTime t) {
        boolean dom = daysOfMonth.contains(t.getDayOfMonth());
        boolean dow = daysOfWeek.contains(t.getDayOfWeek().getValue() % 7);   // 일요일 = 0
        if (dayOfMonthExplicit && dayOfWeekExplicit) return dom || dow;
        if (dayOfMonthExplicit) return dom;
        if (dayOfWeekExplicit) return dow;
        return true;
    }
}
