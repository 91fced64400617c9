package net.crontide.core.model;

/** 표준 5필드의 순서와 허용 범위 */
public enum CronField {
    MINUTE(0, 59),
    HOUR(0, 23),
    DAY_OF_MONTH(1, 31),
    MONTH(1, 12),
    DAY_OF_WEEK(0, 6);   // 0 = 일요일

    private final int min;
    private final int max;

    CronField(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public int min() { return min; }
    public int max() { return max; }

    public boolean contains(int value) {
        return value >= min && value <= max;
    }

    public static boolean isWildcard(String token) {
        return "*".equals(token);
    }
}
