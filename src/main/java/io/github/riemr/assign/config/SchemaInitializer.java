package io.github.riemr.assign.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * 割当最適化で使うテーブルを起動時に用意する。
 * auth_users / sop_documents / user_progress は既存スキーマ側の管理。
 */
@Configuration
@ConditionalOnProperty(name = "assign.schema.initialize", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SchemaInitializer {
    private final JdbcTemplate jdbc;

    @PostConstruct
    public void ensureTables() {
        try {
            jdbc.execute("CREATE TABLE IF NOT EXISTS staff_skill_profiles (" +
                    "id BIGSERIAL PRIMARY KEY, " +
                    "user_id UUID NOT NULL REFERENCES auth_users(id) ON DELETE CASCADE, " +
                    "skill_name TEXT NOT NULL, " +
                    "skill_category TEXT, " +
                    "proficiency_level SMALLINT NOT NULL CHECK (proficiency_level BETWEEN 0 AND 10), " +
                    "updated_at TIMESTAMPTZ DEFAULT now(), " +
                    "UNIQUE (user_id, skill_name)" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_staff_skill_profiles_user ON staff_skill_profiles(user_id)");

            jdbc.execute("CREATE TABLE IF NOT EXISTS sop_assignments (" +
                    "id UUID PRIMARY KEY DEFAULT gen_random_uuid(), " +
                    "restaurant_id UUID NOT NULL, " +
                    "sop_id UUID NOT NULL REFERENCES sop_documents(id), " +
                    "assigned_to UUID NOT NULL REFERENCES auth_users(id), " +
                    "assigned_by UUID, " +
                    "due_date TIMESTAMPTZ, " +
                    "priority VARCHAR(10) NOT NULL DEFAULT 'medium' CHECK (priority IN ('low','medium','high','urgent')), " +
                    "status VARCHAR(16) NOT NULL DEFAULT 'pending' CHECK (status IN ('pending','in_progress','completed','cancelled')), " +
                    "notes TEXT, " +
                    "created_at TIMESTAMPTZ DEFAULT now(), " +
                    "updated_at TIMESTAMPTZ DEFAULT now()" +
                    ")");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_sop_assignments_assignee_status ON sop_assignments(assigned_to, status)");
            jdbc.execute("CREATE INDEX IF NOT EXISTS idx_sop_assignments_restaurant ON sop_assignments(restaurant_id)");

            jdbc.execute("CREATE TABLE IF NOT EXISTS assignment_audit_logs (" +
                    "audit_id BIGSERIAL PRIMARY KEY, " +
                    "restaurant_id VARCHAR(64), " +
                    "user_id VARCHAR(64) NOT NULL, " +
                    "action VARCHAR(16) NOT NULL, " +
                    "resource_type VARCHAR(64) NOT NULL, " +
                    "resource_id VARCHAR(64), " +
                    "details JSONB, " +
                    "created_at TIMESTAMPTZ DEFAULT now()" +
                    ")");

            log.info("Schema checked/initialized: staff_skill_profiles, sop_assignments, assignment_audit_logs ensured.");
        } catch (Exception e) {
            log.warn("Schema initialization failed: {}", e.getMessage());
        }
    }
}
