package io.github.riemr.assign.optimization.model;

import java.util.Locale;

public enum Priority {
    LOW("low", 5),
    MEDIUM("medium", 3),
    HIGH("high", 2),
    URGENT("urgent", 1);

    private final String code;
    private final int dueInDays;

    Priority(String code, int dueInDays) {
        this.code = code;
        this.dueInDays = dueInDays;
    }

    public String getCode() { return code; }

    /** 推奨期限までの基本日数 */
    public int getDueInDays() { return dueInDays; }

    public boolean isHighOrUrgent() {
        return this == HIGH || this == URGENT;
    }

    public static Priority fromCode(String code) {
        if (code == null || code.isBlank()) return null;
        String c = code.trim().toLowerCase(Locale.ROOT);
        for (Priority p : values()) {
            if (p.code.equals(c)) return p;
        }
        throw new IllegalArgumentException("unknown priority: " + code);
    }
}
