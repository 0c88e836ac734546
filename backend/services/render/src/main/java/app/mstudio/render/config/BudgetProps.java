package app.mstudio.render.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "app.render.budget")
public record BudgetProps(
        BigDecimal defaultMonthlyUsd,
        Integer defaultDailyAttempts,
        String zone
) {
    public BudgetProps {
        if (defaultMonthlyUsd == null || defaultMonthlyUsd.signum() < 0) {
            defaultMonthlyUsd = BigDecimal.valueOf(25);
        }
        if (defaultDailyAttempts == null || defaultDailyAttempts < 0) {
            defaultDailyAttempts = 20;
        }
        if (zone == null || zone.isBlank()) {
            zone = "UTC";
        }
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
