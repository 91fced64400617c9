package net.crontide.bootstrap.props;

import net.crontide.core.model.JitterOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("crontide")
public class CrontideProperties {
    private String zone = "UTC";                        // 엔진 로컬 프레임
    private Calculator calculator = Calculator.ENGINE;  // CronCalculator 구현 선택
    private Jitter jitter = new Jitter();               // 스케줄별 지정이 없을 때의 기본 지터
    private Catalog catalog = new Catalog();

    public enum Calculator { ENGINE, CRON_UTILS }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Calculator getCalculator() {
        return calculator;
    }

    public void setCalculator(Calculator calculator) {
        this.calculator = calculator;
    }

    public Jitter getJitter() {
        return jitter;
    }

    public void setJitter(Jitter jitter) {
        this.jitter = jitter;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Jitter {
        private boolean enabled = false;
        private double maxPercent = 0.1;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getMaxPercent() {
            return maxPercent;
        }

        public void setMaxPercent(double maxPercent) {
            this.maxPercent = maxPercent;
        }

        public JitterOptions toOptions() {
            return new JitterOptions(enabled, maxPercent);
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<ScheduleEntry> schedules = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<ScheduleEntry> getSchedules() {
            return schedules;
        }

        public void setSchedules(List<ScheduleEntry> schedules) {
            this.schedules = schedules;
        }
    }

    public static class ScheduleEntry {
        private String name;
        private String cron;
        private String timezoneName;
        private Integer offsetMinutes;      // null 이면 타임존 보정 없음
        private Boolean jitterEnabled;      // null 이면 crontide.jitter 기본값
        private Double jitterMaxPercent;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public String getTimezoneName() {
            return timezoneName;
        }

        public void setTimezoneName(String timezoneName) {
            this.timezoneName = timezoneName;
        }

        public Integer getOffsetMinutes() {
            return offsetMinutes;
        }

        public void setOffsetMinutes(Integer offsetMinutes) {
            this.offsetMinutes = offsetMinutes;
        }

        public Boolean getJitterEnabled() {
            return jitterEnabled;
        }

        public void setJitterEnabled(Boolean jitterEnabled) {
            this.jitterEnabled = jitterEnabled;
        }

        public Double getJitterMaxPercent() {
            return jitterMaxPercent;
        }

        public void setJitterMaxPercent(Double jitterMaxPercent) {
            this.jitterMaxPercent = jitterMaxPercent;
        }

        @Override
        public String toString() {
            return "ScheduleEntry{" +
                    "name='" + name + '\'' +
                    ", cron='" + cron + '\'' +
                    ", timezoneName='" + timezoneName + '\'' +
                    ", offsetMinutes=" + offsetMinutes +
                    ", jitterEnabled=" + jitterEnabled +
                    ", jitterMaxPercent=" + jitterMaxPercent +
                    '}';
        }
    }
}
