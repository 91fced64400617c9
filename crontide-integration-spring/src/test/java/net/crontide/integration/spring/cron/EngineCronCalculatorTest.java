package net.crontide.integration.spring.cron;

import net.crontide.core.model.JitterOptions;
import net.crontide.core.service.CronEngine;
import net.crontide.core.spi.CronCalculator;
import net.crontide.core.spi.EngineLogger;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class EngineCronCalculatorTest {

    final CronEngine engine = CronEngine.builder().logger(EngineLogger.noop()).build();
    final CronCalculator calc = new EngineCronCalculator(engine);

    @Test
    void zone_becomesLocalFrame_resultIsRealInstant() {
        Instant next = calc.next(Instant.parse("2025-03-09T23:30:00Z"), "0 9 * * *", ZoneId.of("Asia/Seoul"));
        assertEquals(Instant.parse("2025-03-10T00:00:00Z"), next);
    }

    @Test
    void cursorAlwaysMovesForward() {
        Instant from = Instant.parse("2025-03-10T10:15:00Z");
        assertEquals(Instant.parse("2025-03-10T10:30:00Z"), calc.next(from, "*/15 * * * *", ZoneOffset.UTC));
        assertEquals(Instant.parse("2025-03-10T10:16:00Z"), calc.next(from, "* * * * *", ZoneOffset.UTC));
    }

    @Test
    void listWithStepElement_firesOnlyOnListedMinutes() {
        Instant from = Instant.parse("2025-03-10T20:16:30Z");
        Instant first = calc.next(from, "1,*/20 * * * *", ZoneOffset.UTC);
        assertEquals(Instant.parse("2025-03-10T20:20:00Z"), first);
        assertEquals(Instant.parse("2025-03-10T20:40:00Z"), calc.next(first, "1,*/20 * * * *", ZoneOffset.UTC));
    }

    @Test
    void macro_isFromPlusInterval() {
        Instant from = Instant.parse("2025-03-10T10:15:30Z");
        assertEquals(from.plus(Duration.ofHours(1)), calc.next(from, "@hourly", ZoneOffset.UTC));
    }

    @Test
    void agreesWithCronUtils_withinSearchWindow() {
        CronCalculator strict = new CronUtilsCalculator();
        Instant from = Instant.parse("2025-03-10T08:00:00Z");   // 월요일
        for (String expr : List.of("*/15 * * * *", "30 9 * * 1-5", "0 */2 * * *", "5,35 * * * *", "0 18 * * *")) {
            for (ZoneId zone : List.of(ZoneOffset.UTC, ZoneId.of("Europe/Berlin"), ZoneId.of("Asia/Seoul"))) {
                assertEquals(strict.next(from, expr, zone), calc.next(from, expr, zone), expr + " @ " + zone);
            }
        }
    }

    @Test
    void configuredJitter_onlyPullsEarlier() {
        var jittered = new EngineCronCalculator(engine, JitterOptions.upTo(0.5));
        Instant from = Instant.parse("2025-03-10T08:00:00Z");
        Instant exact = calc.next(from, "0 12 * * *", ZoneOffset.UTC);
        assertThat(jittered.next(from, "0 12 * * *", ZoneOffset.UTC)).isBeforeOrEqualTo(exact).isAfter(from);
    }
}
