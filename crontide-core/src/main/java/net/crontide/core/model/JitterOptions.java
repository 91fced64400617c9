package net.crontide.core.model;

/**
 * 지터 정책. 활성화되면 간격의 [0, maxPercent] 비율만큼을 빼서 간격을 줄인다 (늘리지는 않음).
 * maxPercent 범위 보정은 적용 시점에 한다.
 */
public record JitterOptions(boolean enabled, double maxPercent) {

    public static JitterOptions disabled() {
        return new JitterOptions(false, 0);
    }

    public static JitterOptions upTo(double maxPercent) {
        return new JitterOptions(true, maxPercent);
    }

    /** null 이거나 비활성, 또는 maxPercent <= 0 이면 no-op */
    public static boolean isActive(JitterOptions options) {
        return options != null && options.enabled() && options.maxPercent() > 0;
    }

    public double clampedPercent() {
        return Math.min(Math.max(maxPercent, 0), 1);
    }
}
