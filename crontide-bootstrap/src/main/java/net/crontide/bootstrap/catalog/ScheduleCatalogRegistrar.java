package net.crontide.bootstrap.catalog;

import net.crontide.bootstrap.props.CrontideProperties;
import net.crontide.core.model.JitterOptions;
import net.crontide.core.model.ScheduleDef;
import net.crontide.core.model.TimezoneInfo;
import net.crontide.core.service.ScheduleResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class ScheduleCatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(ScheduleCatalogRegistrar.class);

    private final ScheduleCatalog catalog;
    private final ScheduleResolver resolver;
    private final JitterOptions defaultJitter;

    public ScheduleCatalogRegistrar(ScheduleCatalog catalog,
                                    ScheduleResolver resolver,
                                    JitterOptions defaultJitter) {
        this.catalog = catalog;
        this.resolver = resolver;
        this.defaultJitter = defaultJitter;
    }

    /**
     * 설정된 스케줄을 모두 등록하고 첫 실행 계획을 로그로 남긴다. 등록된 이름 목록 반환.
     * 항목 하나라도 잘못되면(이름 누락, 중복) 아무것도 등록하지 않는다.
     */
    public List<String> register(CrontideProperties.Catalog config) {
        List<ScheduleDef> defs = new ArrayList<>();
        for (var entry : config.getSchedules()) {
            defs.add(toDef(entry));
        }
        catalog.registerAll(defs);

        List<String> registered = new ArrayList<>();
        for (ScheduleDef def : defs) {
            // 무효 표현식은 여기서 @hourly 로 대체되며 경고가 남는다
            var plan = resolver.resolve(def);
            log.info("Schedule registered: name='{}' cron='{}' defaulted={} intervalMs={} next={}",
                    def.id(), plan.effectiveExpression(), plan.defaulted(), plan.intervalMs(), plan.nextFireAt());
            registered.add(def.id());
        }
        return registered;
    }

    ScheduleDef toDef(CrontideProperties.ScheduleEntry entry) {
        if (entry.getName() == null || entry.getName().isBlank()) {
            throw new IllegalArgumentException("schedule.name is required: " + entry);
        }

        TimezoneInfo tz = null;
        if (entry.getOffsetMinutes() != null) {
            String label = entry.getTimezoneName() != null ? entry.getTimezoneName() : "UTC" + formatOffset(entry.getOffsetMinutes());
            tz = TimezoneInfo.fixed(label, entry.getOffsetMinutes());
        }

        JitterOptions jitter = defaultJitter;
        if (entry.getJitterEnabled() != null) {
            double max = entry.getJitterMaxPercent() != null
                    ? entry.getJitterMaxPercent()
                    : (defaultJitter != null ? defaultJitter.maxPercent() : 0);
            jitter = new JitterOptions(entry.getJitterEnabled(), max);
        }

        return new ScheduleDef(entry.getName(), entry.getCron(), tz, jitter);
    }

    // +09:00, -05:30
    private static String formatOffset(int minutes) {
        int abs = Math.abs(minutes);
        return String.format("%s%02d:%02d", minutes < 0 ? "-" : "+", abs / 60, abs % 60);
    }
}
