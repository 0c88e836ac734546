package app.mstudio.render.recommend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

public enum BudgetBand {
    UP_TO_5("$0-$5", new BigDecimal("5")),
    UP_TO_25("$5-$25", new BigDecimal("25")),
    UP_TO_100("$25-$100", new BigDecimal("100")),
    UNLIMITED("unlimited", null);

    private final String label;
    private final BigDecimal cap;

    BudgetBand(String label, BigDecimal cap) {
        this.label = label;
        this.cap = cap;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean allows(BigDecimal cost) {
        return cap == null || cost.compareTo(cap) <= 0;
    }

    public boolean isUnlimited() {
        return cap == null;
    }

    @JsonCreator
    public static BudgetBand fromLabel(String value) {
        if (value == null) {
            return null;
        }
        for (BudgetBand band : values()) {
            if (band.label.equalsIgnoreCase(value.trim()) || band.name().equalsIgnoreCase(value.trim())) {
                return band;
            }
        }
        throw new IllegalArgumentException("Unknown budget band: " + value);
    }
}
