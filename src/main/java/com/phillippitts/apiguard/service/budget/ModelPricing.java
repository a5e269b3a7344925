package com.phillippitts.apiguard.service.budget;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-model price table used to estimate the cost of a call.
 *
 * <p>Lookup order: the segment after the last {@code '/'} (so {@code openrouter/gpt-4o} prices as
 * {@code gpt-4o}), then the full model name, then the default rate. Prefixed entries in the table
 * only apply when the bare model name is unknown.
 */
public final class ModelPricing {

    /** Conservative rate for models missing from the table. */
    public static final ModelPrice DEFAULT_PRICE = new ModelPrice(2.00, 8.00);

    private static final Map<String, ModelPrice> BUILT_IN;

    static {
        Map<String, ModelPrice> table = new LinkedHashMap<>();
        table.put("gpt-4o", new ModelPrice(2.50, 10.00));
        table.put("gpt-4o-mini", new ModelPrice(0.15, 0.60));
        table.put("gpt-4-turbo", new ModelPrice(10.00, 30.00));
        table.put("gpt-3.5-turbo", new ModelPrice(0.50, 1.50));
        table.put("claude-3-5-sonnet-20241022", new ModelPrice(3.00, 15.00));
        table.put("claude-3-5-haiku-20241022", new ModelPrice(0.80, 4.00));
        table.put("claude-3-opus-20240229", new ModelPrice(15.00, 75.00));
        // Proxied through OpenRouter, with its markup
        table.put("anthropic/claude-3-5-sonnet-20241022", new ModelPrice(3.00, 15.00));
        table.put("anthropic/claude-3-5-haiku-20241022", new ModelPrice(1.00, 5.00));
        BUILT_IN = Collections.unmodifiableMap(table);
    }

    private final Map<String, ModelPrice> prices;
    private final ModelPrice defaultPrice;

    public ModelPricing(Map<String, ModelPrice> prices, ModelPrice defaultPrice) {
        this.prices = Map.copyOf(Objects.requireNonNull(prices, "prices"));
        this.defaultPrice = Objects.requireNonNull(defaultPrice, "defaultPrice");
    }

    /** Built-in table with the built-in default rate. */
    public static ModelPricing defaults() {
        return new ModelPricing(BUILT_IN, DEFAULT_PRICE);
    }

    /**
     * Built-in table extended (or overridden) by {@code overrides}.
     */
    public static ModelPricing withOverrides(Map<String, ModelPrice> overrides, ModelPrice defaultPrice) {
        Map<String, ModelPrice> merged = new LinkedHashMap<>(BUILT_IN);
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return new ModelPricing(merged, defaultPrice == null ? DEFAULT_PRICE : defaultPrice);
    }

    public ModelPrice priceFor(String model) {
        if (model == null || model.isBlank()) {
            return defaultPrice;
        }
        int slash = model.lastIndexOf('/');
        if (slash >= 0 && slash < model.length() - 1) {
            ModelPrice bare = prices.get(model.substring(slash + 1));
            if (bare != null) {
                return bare;
            }
        }
        return prices.getOrDefault(model, defaultPrice);
    }

    /**
     * {@code input/1M * inputRate + output/1M * outputRate}, unrounded.
     */
    public double estimateCost(String model, long inputUnits, long outputUnits) {
        return priceFor(model).cost(inputUnits, outputUnits);
    }

    public Map<String, ModelPrice> prices() {
        return prices;
    }

    public ModelPrice defaultPrice() {
        return defaultPrice;
    }
}
