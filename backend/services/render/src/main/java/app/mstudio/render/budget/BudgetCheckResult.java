package app.mstudio.render.budget;

import java.math.BigDecimal;

public record BudgetCheckResult(
        boolean allowed,
        String reason,
        BigDecimal monthlySpent,
        BigDecimal monthlyLimit,
        long dailyAttempts,
        int dailyLimit
) {
}
