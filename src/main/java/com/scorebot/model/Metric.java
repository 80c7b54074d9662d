package com.scorebot.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Known raw metrics, keyed by the provider field name.
 */
public enum Metric {
    MOMENTUM_3M("momentum_3m", Category.MOMENTUM, Direction.HIGHER_IS_BETTER),
    MOMENTUM_6M("momentum_6m", Category.MOMENTUM, Direction.HIGHER_IS_BETTER),
    MOMENTUM_12M("momentum_12m", Category.MOMENTUM, Direction.HIGHER_IS_BETTER),

    TRAILING_PE("trailing_pe", Category.VALUE, Direction.LOWER_IS_BETTER),
    PRICE_TO_BOOK("price_to_book", Category.VALUE, Direction.LOWER_IS_BETTER),
    PRICE_TO_SALES("price_to_sales_ttm", Category.VALUE, Direction.LOWER_IS_BETTER),
    PEG_RATIO("peg_ratio", Category.VALUE, Direction.LOWER_IS_BETTER),

    RETURN_ON_EQUITY("return_on_equity_pct", Category.QUALITY, Direction.HIGHER_IS_BETTER),
    RETURN_ON_ASSETS("return_on_assets_pct", Category.QUALITY, Direction.HIGHER_IS_BETTER),
    FCF_TO_NET_INCOME("fcf_to_net_income", Category.QUALITY, Direction.HIGHER_IS_BETTER),
    EPS_GROWTH_STABILITY("eps_growth_stability", Category.QUALITY, Direction.HIGHER_IS_BETTER),
    GROSS_MARGIN("gross_margin_pct", Category.QUALITY, Direction.HIGHER_IS_BETTER),
    OPERATING_MARGIN("operating_margin_pct", Category.QUALITY, Direction.HIGHER_IS_BETTER),
    PROFIT_MARGIN("profit_margin_pct", Category.QUALITY, Direction.HIGHER_IS_BETTER),

    SUSTAINABLE_GROWTH_RATE("sustainable_growth_rate", Category.GROWTH, Direction.HIGHER_IS_BETTER),
    FCF_GROWTH_YOY("fcf_growth_yoy", Category.GROWTH, Direction.HIGHER_IS_BETTER),
    OCF_GROWTH_YOY("ocf_growth_yoy", Category.GROWTH, Direction.HIGHER_IS_BETTER),

    VOLATILITY_12M("volatility_12m", Category.STABILITY, Direction.LOWER_IS_BETTER),
    DOWNSIDE_VOLATILITY("downside_volatility", Category.STABILITY, Direction.LOWER_IS_BETTER),
    // drawdown is reported as a negative percentage, so closer to zero is better
    MAX_DRAWDOWN_52W("max_drawdown_52w", Category.STABILITY, Direction.HIGHER_IS_BETTER),
    BETA("beta", Category.STABILITY, Direction.LOWER_IS_BETTER),

    INSTITUTIONAL_OWNERSHIP("institutional_ownership_pct", Category.POSITIONING, Direction.HIGHER_IS_BETTER),
    INSIDER_OWNERSHIP("insider_ownership_pct", Category.POSITIONING, Direction.HIGHER_IS_BETTER),
    SHORT_INTEREST("short_interest_pct", Category.POSITIONING, Direction.LOWER_IS_BETTER),

    ANALYST_BULLISH_COUNT("analyst_bullish_count", Category.SENTIMENT, Direction.HIGHER_IS_BETTER);

    public enum Direction {
        HIGHER_IS_BETTER,
        LOWER_IS_BETTER
    }

    private final String key;
    private final Category category;
    private final Direction direction;

    Metric(String key, Category category, Direction direction) {
        this.key = key;
        this.category = category;
        this.direction = direction;
    }

    public String key() {
        return key;
    }

    public Category category() {
        return category;
    }

    public Direction direction() {
        return direction;
    }

    /**
     * Maps a raw value onto the "higher is better" axis used by the normalizer.
     */
    public double oriented(double raw) {
        return direction == Direction.LOWER_IS_BETTER ? -raw : raw;
    }

    public static Metric fromKey(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (Metric metric : values()) {
            if (metric.key.equals(target)) {
                return metric;
            }
        }
        return null;
    }

    public static List<Metric> ofCategory(Category category) {
        List<Metric> out = new ArrayList<>();
        for (Metric metric : values()) {
            if (metric.category == category) {
                out.add(metric);
            }
        }
        return Collections.unmodifiableList(out);
    }

    public static List<Metric> compositeEligible() {
        List<Metric> out = new ArrayList<>();
        for (Metric metric : values()) {
            if (metric.category.compositeEligible()) {
                out.add(metric);
            }
        }
        return Collections.unmodifiableList(out);
    }
}
