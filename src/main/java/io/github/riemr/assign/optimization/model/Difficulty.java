package io.github.riemr.assign.optimization.model;

import java.util.Locale;

/**
 * SOP の難易度。targetProficiency はこの難易度に見合う習熟度 (1..10)。
 */
public enum Difficulty {
    BEGINNER("beginner", 3),
    INTERMEDIATE("intermediate", 6),
    ADVANCED("advanced", 9);

    /** 難易度が不明な場合の目標習熟度 */
    public static final int DEFAULT_TARGET_PROFICIENCY = 5;

    private final String code;
    private final int targetProficiency;

    Difficulty(String code, int targetProficiency) {
        this.code = code;
        this.targetProficiency = targetProficiency;
    }

    public String getCode() { return code; }

    public static int targetProficiencyOf(Difficulty difficulty) {
        return difficulty == null ? DEFAULT_TARGET_PROFICIENCY : difficulty.targetProficiency;
    }

    public static Difficulty fromCode(String code) {
        if (code == null) return null;
        String c = code.trim().toLowerCase(Locale.ROOT);
        for (Difficulty d : values()) {
            if (d.code.equals(c)) return d;
        }
        return null;
    }
}
