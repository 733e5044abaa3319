package io.github.riemr.assign.optimization.model;

import java.util.Locale;

public enum CommitmentStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String code;

    CommitmentStatus(String code) {
        this.code = code;
    }

    public String getCode() { return code; }

    public boolean isActive() {
        return this == PENDING || this == IN_PROGRESS;
    }

    public static CommitmentStatus fromCode(String code) {
        if (code == null) return null;
        String c = code.trim().toLowerCase(Locale.ROOT);
        for (CommitmentStatus s : values()) {
            if (s.code.equals(c)) return s;
        }
        return null;
    }
}
