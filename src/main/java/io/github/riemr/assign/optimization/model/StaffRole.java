package io.github.riemr.assign.optimization.model;

import java.util.List;
import java.util.Locale;

/**
 * スタッフの職種。職種ごとに得意とする SOP カテゴリのキーワードを持つ。
 */
public enum StaffRole {
    CHEF("chef", List.of("cooking", "food", "kitchen", "prep", "recipe")),
    SERVER("server", List.of("service", "customer", "dining", "order", "table")),
    MANAGER("manager", List.of("management", "admin", "supervision", "operation")),
    // admin は全カテゴリを扱える
    ADMIN("admin", List.of());

    private final String code;
    private final List<String> keywords;

    StaffRole(String code, List<String> keywords) {
        this.code = code;
        this.keywords = keywords;
    }

    public String getCode() { return code; }
    public List<String> getKeywords() { return keywords; }

    public boolean coversAllCategories() {
        return this == ADMIN;
    }

    /** 未知のコードは null を返す。 */
    public static StaffRole fromCode(String code) {
        if (code == null) return null;
        String c = code.trim().toLowerCase(Locale.ROOT);
        for (StaffRole r : values()) {
            if (r.code.equals(c)) return r;
        }
        return null;
    }
}
