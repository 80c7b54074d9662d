package com.scorebot.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A security in the scoring universe.
 */
public record Symbol(String ticker, String sector, AssetType assetType) {
    public Symbol {
        if (ticker == null || ticker.trim().isEmpty()) {
            throw new IllegalArgumentException("ticker must not be empty");
        }
        ticker = ticker.trim().toUpperCase(Locale.ROOT);
        sector = sector == null ? "" : sector.trim();
        assetType = assetType == null ? AssetType.EQUITY : assetType;
    }

    public static Symbol of(String ticker) {
        return new Symbol(ticker, "", AssetType.EQUITY);
    }

    public enum AssetType {
        EQUITY,
        FUND,
        SPAC,
        OTHER;

        public static AssetType fromText(String raw) {
            if (raw == null || raw.trim().isEmpty()) {
                return EQUITY;
            }
            String value = raw.trim().toUpperCase(Locale.ROOT);
            for (AssetType type : values()) {
                if (type.name().equals(value)) {
                    return type;
                }
            }
            if ("ETF".equals(value) || "MUTUAL_FUND".equals(value)) {
                return FUND;
            }
            if ("STOCK".equals(value) || "COMMON".equals(value)) {
                return EQUITY;
            }
            return OTHER;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Symbol other)) {
            return false;
        }
        return ticker.equals(other.ticker);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ticker);
    }
}
