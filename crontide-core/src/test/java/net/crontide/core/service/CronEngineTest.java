package net.crontide.core.service;

import net.crontide.core.model.JitterOptions;
import net.crontide.core.model.TimezoneInfo;
import net.crontide.core.spi.EngineLogger;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronEngineTest {

    @Test
    void exposesTheFourOperations() {
        var engine = CronEngine.builder().logger(EngineLogger.noop()).build();

        assertTrue(engine.isValidCronExpression("* * * * *"));
        assertFalse(engine.isValidCronExpression("61 * * * *"));
        assertEquals(3_600_000, engine.parseCronToMs("@hourly"));
        assertEquals(300_000, engine.parseCronToMs("@every_5_minutes"));
        assertEquals(Instant.parse("2025-03-11T00:00:00Z"),
                engine.getNextExecutionTime("0 0 * * *", Instant.parse("2025-03-10T20:15:30Z")));
        assertThat(engine.parseField("1-3", 0, 59)).containsExactly(1, 2, 3);
    }

    @Test
    void defaultBaseTime_comesFromInjectedClock() {
        var engine = CronEngine.builder()
                .clock(() -> Instant.parse("2025-03-10T10:07:12Z"))
                .build();
        assertEquals(Instant.parse("2025-03-10T10:15:00Z"), engine.getNextExecutionTime("*/15 * * * *"));
    }

    @Test
    void builderWiresRandomSourceAndLocalZone() {
        var engine = CronEngine.builder()
                .random(() -> 0.5)
                .localZone(ZoneOffset.ofHours(9))
                .build();
        assertEquals(ZoneOffset.ofHours(9), engine.localZone());
        assertEquals(1_800_000, engine.parseCronToMs("@hourly", JitterOptions.upTo(1)));
        assertEquals(750, engine.applyJitter(1_000, JitterOptions.upTo(0.5)));
    }

    @Test
    void warningsGoThroughInjectedLogger() {
        List<String> warnings = new ArrayList<>();
        var engine = CronEngine.builder().logger(warnings::add).build();
        engine.getNextExecutionTime("not a cron", Instant.EPOCH);
        assertThat(warnings).hasSize(1);
    }

    @Test
    void sharedAcrossThreads_givesSameAnswers() throws Exception {
        var engine = CronEngine.defaults();
        Instant base = Instant.parse("2025-03-10T20:15:30Z");
        var seoul = TimezoneInfo.fixed("Asia/Seoul", 540);
        Instant expected = engine.getNextExecutionTime("0 9 * * 1-5", base, seoul);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Instant>> calls = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                calls.add(() -> engine.getNextExecutionTime("0 9 * * 1-5", base, seoul));
            }
            for (Future<Instant> f : pool.invokeAll(calls)) {
                assertEquals(expected, f.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
