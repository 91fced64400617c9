package net.crontide.bootstrap.autoconfigure;

import net.crontide.bootstrap.catalog.ScheduleCatalog;
import net.crontide.bootstrap.catalog.ScheduleCatalogRegistrar;
import net.crontide.bootstrap.props.CrontideProperties;
import net.crontide.core.service.CronEngine;
import net.crontide.core.service.ScheduleResolver;
import net.crontide.core.spi.Clock;
import net.crontide.core.spi.CronCalculator;
import net.crontide.core.spi.EngineLogger;
import net.crontide.core.spi.RandomSource;
import net.crontide.integration.spring.cron.CronUtilsCalculator;
import net.crontide.integration.spring.cron.EngineCronCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.ZoneId;

@AutoConfiguration
@EnableConfigurationProperties(CrontideProperties.class)
public class CrontideAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CrontideAutoConfiguration.class);

    // --- 엔진 협력 객체 (사용자 빈이 있으면 그것을 쓴다) ---

    // 엔진 경고는 slf4j 로 (logger 이름: CronEngine)
    @Bean
    @ConditionalOnMissingBean
    public EngineLogger engineLogger() {
        return EngineLogger.slf4j(CronEngine.class);
    }

    @Bean
    @ConditionalOnMissingBean
    public RandomSource randomSource() {
        return RandomSource.threadLocal();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock systemClock() {
        return Clock.system();
    }

    // --- 엔진 ---

    @Bean
    @ConditionalOnMissingBean
    public CronEngine cronEngine(EngineLogger logger, RandomSource random, Clock clock, CrontideProperties props) {
        return CronEngine.builder()
                .logger(logger)
                .random(random)
                .clock(clock)
                .localZone(ZoneId.of(props.getZone()))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleResolver scheduleResolver(CronEngine engine, EngineLogger logger) {
        return new ScheduleResolver(engine, logger);
    }

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(CronCalculator.class)
    public CronCalculator cronCalculator(CronEngine engine, CrontideProperties props) {
        return switch (props.getCalculator()) {
            case CRON_UTILS -> new CronUtilsCalculator();
            case ENGINE -> new EngineCronCalculator(engine, props.getJitter().toOptions());
        };
    }

    // --- 카탈로그 ---

    @Bean
    @ConditionalOnMissingBean
    public ScheduleCatalog scheduleCatalog(ScheduleResolver resolver) {
        return new ScheduleCatalog(resolver);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleCatalogRegistrar scheduleCatalogRegistrar(ScheduleCatalog catalog,
                                                             ScheduleResolver resolver,
                                                             CrontideProperties props) {
        return new ScheduleCatalogRegistrar(catalog, resolver, props.getJitter().toOptions());
    }

    @Bean
    @ConditionalOnProperty(prefix = "crontide.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(ScheduleCatalogRegistrar registrar,
                                           CrontideProperties props) {
        log.info("[Crontide] catalog: {} schedule(s), zone={}, calculator={}",
                props.getCatalog().getSchedules().size(), props.getZone(), props.getCalculator());
        return args -> registrar.register(props.getCatalog());
    }
}
