package net.crontide.bootstrap.autoconfigure;

import net.crontide.bootstrap.catalog.ScheduleCatalog;
import net.crontide.bootstrap.props.CrontideProperties;
import net.crontide.core.service.CronEngine;
import net.crontide.core.service.ScheduleResolver;
import net.crontide.core.spi.Clock;
import net.crontide.core.spi.CronCalculator;
import net.crontide.core.spi.EngineLogger;
import net.crontide.core.spi.RandomSource;
import net.crontide.integration.spring.cron.CronUtilsCalculator;
import net.crontide.integration.spring.cron.EngineCronCalculator;
import org.junit.jupiter.api.Test;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CrontideAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CrontideAutoConfiguration.class));

    @Test
    void defaults() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(CronEngine.class)
                    .hasSingleBean(ScheduleResolver.class)
                    .hasSingleBean(ScheduleCatalog.class)
                    .hasSingleBean(ApplicationRunner.class)
                    .hasSingleBean(Clock.class)
                    .hasSingleBean(RandomSource.class)
                    .hasSingleBean(EngineLogger.class);
            assertThat(ctx.getBean(CronCalculator.class)).isInstanceOf(EngineCronCalculator.class);
            assertThat(ctx.getBean(CronEngine.class).localZone()).isEqualTo(ZoneId.of("UTC"));
        });
    }

    @Test
    void zoneAndCalculator_fromProperties() {
        runner.withPropertyValues("crontide.zone=Asia/Seoul", "crontide.calculator=cron-utils")
                .run(ctx -> {
                    assertThat(ctx.getBean(CronEngine.class).localZone()).isEqualTo(ZoneId.of("Asia/Seoul"));
                    assertThat(ctx.getBean(CronCalculator.class)).isInstanceOf(CronUtilsCalculator.class);
                    assertThat(ctx.getBean(CrontideProperties.class).getCalculator())
                            .isEqualTo(CrontideProperties.Calculator.CRON_UTILS);
                });
    }

    @Test
    void catalogRunner_canBeSwitchedOff() {
        runner.withPropertyValues("crontide.catalog.enabled=false")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(ApplicationRunner.class));
    }

    @Test
    void userCalculatorWins() {
        CronCalculator mine = (from, expr, zone) -> from;
        runner.withBean(CronCalculator.class, () -> mine)
                .run(ctx -> assertThat(ctx.getBean(CronCalculator.class)).isSameAs(mine));
    }

    @Test
    void userSpiBeans_replaceDefaults() {
        Instant fixed = Instant.parse("2025-03-10T20:16:30Z");
        Clock clock = () -> fixed;
        RandomSource random = () -> 0.0;
        List<String> warnings = new ArrayList<>();
        EngineLogger logger = warnings::add;

        runner.withBean("myClock", Clock.class, () -> clock)
                .withBean("myRandom", RandomSource.class, () -> random)
                .withBean("myLogger", EngineLogger.class, () -> logger)
                .run(ctx -> {
                    assertThat(ctx).hasNotFailed()
                            .hasSingleBean(Clock.class)
                            .hasSingleBean(RandomSource.class)
                            .hasSingleBean(EngineLogger.class);
                    CronEngine engine = ctx.getBean(CronEngine.class);
                    assertThat(engine.clock()).isSameAs(clock);
                    assertThat(engine.getNextExecutionTime("@hourly")).isEqualTo(fixed.plusSeconds(3600));

                    engine.getNextExecutionTime("a b c");
                    assertThat(warnings).hasSize(1);
                });
    }

    @Test
    void catalogSchedules_bindFromProperties() {
        runner.withPropertyValues(
                        "crontide.jitter.enabled=true",
                        "crontide.jitter.max-percent=0.25",
                        "crontide.catalog.schedules[0].name=warm-products",
                        "crontide.catalog.schedules[0].cron=*/15 * * * *",
                        "crontide.catalog.schedules[0].offset-minutes=540",
                        "crontide.catalog.schedules[0].timezone-name=Asia/Seoul")
                .run(ctx -> {
                    var props = ctx.getBean(CrontideProperties.class);
                    assertThat(props.getJitter().toOptions().maxPercent()).isEqualTo(0.25);
                    var entry = props.getCatalog().getSchedules().get(0);
                    assertThat(entry.getName()).isEqualTo("warm-products");
                    assertThat(entry.getCron()).isEqualTo("*/15 * * * *");
                    assertThat(entry.getOffsetMinutes()).isEqualTo(540);
                    assertThat(entry.getTimezoneName()).isEqualTo("Asia/Seoul");
                });
    }
}
