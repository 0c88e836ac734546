package app.mstudio.render.budget;

import java.math.BigDecimal;

public record BudgetSettings(BigDecimal monthlyLimitUsd, int dailyAttemptsLimit) {
}
