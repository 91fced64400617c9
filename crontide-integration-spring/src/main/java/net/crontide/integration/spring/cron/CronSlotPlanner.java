package net.crontide.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import net.crontide.core.model.CronMacro;
import net.crontide.core.parse.CronFields;

import java.time.Instant;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * cron-utils(UNIX 정의) 기반 정확한 슬롯 계산기. 엔진과 달리 탐색 한도가 없고 잘못된 표현식에는 예외를 던진다.
 * 매크로는 5필드 형태로, 6필드는 앞 5필드만 써서 정규화한다.
 */
public final class CronSlotPlanner {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    // 정규화된 표현식 기준 LRU(최대 256개)
    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(256);

    private CronSlotPlanner() { }

    public static SlotInfo compute(String cronExpr, ZoneId zone, Instant now) {
        Objects.requireNonNull(cronExpr); Objects.requireNonNull(zone); Objects.requireNonNull(now);

        final ExecutionTime et = executionTime(cronExpr);

        var base = now.atZone(zone);
        var next = et.nextExecution(base).orElseThrow(
                () -> new IllegalStateException("No next execution for [" + cronExpr + "] at " + base));
        var slotStart = et.lastExecution(next).orElseGet(() ->
                et.lastExecution(base).orElseThrow(
                        () -> new IllegalStateException("No last execution for [" + cronExpr + "] at " + base)));

        return new SlotInfo(slotStart.toInstant(), next.toInstant());
    }

    /** 매크로 → 5필드, 6필드 → 앞 5필드. 필드 수가 틀리면 IllegalArgumentException */
    static String normalize(String cronExpr) {
        var macro = CronMacro.find(cronExpr);
        if (macro.isPresent()) return macro.get().fiveField();

        CronFields f = CronFields.split(cronExpr).orElseThrow(() ->
                new IllegalArgumentException("Cron must have 5 or 6 fields or be a known macro: [" + cronExpr + "]"));
        return String.join(" ", f.minute(), f.hour(), f.dayOfMonth(), f.month(), f.dayOfWeek());
    }

    private static ExecutionTime executionTime(String cronExpr) {
        String key = normalize(cronExpr);
        synchronized (CACHE) {
            return CACHE.computeIfAbsent(key, expr -> ExecutionTime.forCron(PARSER.parse(expr)));
        }
    }

    static int cacheSize() { synchronized (CACHE) { return CACHE.size(); } }

    public static void invalidate(String expr) { synchronized (CACHE) { CACHE.remove(normalize(expr)); } }
    public static void invalidateAll() { synchronized (CACHE) { CACHE.clear(); } }

    public record SlotInfo(Instant slotStartUtc, Instant nextUtc) {
        public String key(String ns) { return ns + ":" + slotStartUtc; }
    }

    // --- 내부 LRU ---
    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
