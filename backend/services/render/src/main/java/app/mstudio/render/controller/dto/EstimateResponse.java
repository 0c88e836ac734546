package app.mstudio.render.controller.dto;

import java.math.BigDecimal;

public record EstimateResponse(
        String provider,
        String model,
        int durationSeconds,
        BigDecimal estimatedCostUsd,
        boolean withinBudget,
        String warning,
        BigDecimal monthlySpent,
        BigDecimal monthlyLimit,
        long dailyAttempts,
        int dailyLimit
) {
}
