package app.mstudio.render.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "workspace_render_settings", schema = "app_render")
public class WorkspaceRenderSettingsEntity {

    @Id
    @Column(name = "workspace_id", nullable = false)
    private UUID workspaceId;

    @Column(name = "monthly_budget_usd")
    private BigDecimal monthlyBudgetUsd;

    @Column(name = "daily_attempts_max")
    private Integer dailyAttemptsMax;

    @Column(name = "updated_at")
    private Instant updatedAt;

    public WorkspaceRenderSettingsEntity() {
    }

    public UUID getWorkspaceId() {
        return workspaceId;
    }

    public void setWorkspaceId(UUID workspaceId) {
        this.workspaceId = workspaceId;
    }

    public BigDecimal getMonthlyBudgetUsd() {
        return monthlyBudgetUsd;
    }

    public void setMonthlyBudgetUsd(BigDecimal monthlyBudgetUsd) {
        this.monthlyBudgetUsd = monthlyBudgetUsd;
    }

    public Integer getDailyAttemptsMax() {
        return dailyAttemptsMax;
    }

    public void setDailyAttemptsMax(Integer dailyAttemptsMax) {
        this.dailyAttemptsMax = dailyAttemptsMax;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
