package com.phillippitts.apiguard.config.properties;

import com.phillippitts.apiguard.service.budget.CostTrackerConfig;
import com.phillippitts.apiguard.service.budget.CostTrackerRegistry;
import com.phillippitts.apiguard.service.budget.ModelPrice;
import com.phillippitts.apiguard.service.budget.ModelPricing;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Budget and pricing settings ({@code apiguard.budget.*}).
 */
@ConfigurationProperties(prefix = "apiguard.budget")
@Validated
public class BudgetProperties {

    /** Ceiling of the {@code global} tracker in USD; unset means unlimited. */
    @PositiveOrZero(message = "Global budget must not be negative")
    private Double globalBudgetUsd;

    /** Ceiling of every other tracker (per job or run) in USD; unset means unlimited. */
    @PositiveOrZero(message = "Per-scope budget must not be negative")
    private Double scopeBudgetUsd;

    /** Throw once a ceiling is exceeded. */
    private boolean enforce = true;

    /** Budget usage, in percent, that raises a warning alert. */
    @DecimalMin(value = "1.0", message = "Warning percent must be between 1 and 100")
    @DecimalMax(value = "100.0", message = "Warning percent must be between 1 and 100")
    private double warningPercent = CostTrackerConfig.DEFAULT_WARNING_PERCENT;

    /** Extra or replacement model prices, keyed by model name. */
    @Valid
    private Map<String, Price> pricing = new LinkedHashMap<>();

    /** Price of models missing from the table; unset keeps the built-in default. */
    @Valid
    private Price defaultPrice;

    public Double getGlobalBudgetUsd() {
        return globalBudgetUsd;
    }

    public void setGlobalBudgetUsd(Double globalBudgetUsd) {
        this.globalBudgetUsd = globalBudgetUsd;
    }

    public Double getScopeBudgetUsd() {
        return scopeBudgetUsd;
    }

    public void setScopeBudgetUsd(Double scopeBudgetUsd) {
        this.scopeBudgetUsd = scopeBudgetUsd;
    }

    public boolean isEnforce() {
        return enforce;
    }

    public void setEnforce(boolean enforce) {
        this.enforce = enforce;
    }

    public double getWarningPercent() {
        return warningPercent;
    }

    public void setWarningPercent(double warningPercent) {
        this.warningPercent = warningPercent;
    }

    public Map<String, Price> getPricing() {
        return pricing;
    }

    public void setPricing(Map<String, Price> pricing) {
        this.pricing = pricing;
    }

    public Price getDefaultPrice() {
        return defaultPrice;
    }

    public void setDefaultPrice(Price defaultPrice) {
        this.defaultPrice = defaultPrice;
    }

    /**
     * Configuration for the tracker named {@code name}; the {@code global} tracker gets the global
     * ceiling, any other tracker the per-scope ceiling with its name as scope id.
     */
    public CostTrackerConfig resolve(String name) {
        if (CostTrackerRegistry.GLOBAL.equals(name)) {
            return new CostTrackerConfig(globalBudgetUsd, enforce, null, warningPercent);
        }
        return new CostTrackerConfig(scopeBudgetUsd, enforce, name, warningPercent);
    }

    /**
     * Built-in price table merged with the configured prices.
     */
    public ModelPricing toModelPricing() {
        Map<String, ModelPrice> overrides = new LinkedHashMap<>();
        pricing.forEach((model, price) -> overrides.put(model, price.toModelPrice()));
        return ModelPricing.withOverrides(overrides, defaultPrice == null ? null : defaultPrice.toModelPrice());
    }

    /**
     * USD per one million units.
     */
    public static class Price {

        @PositiveOrZero(message = "Input price must not be negative")
        private double inputPerMillion;

        @PositiveOrZero(message = "Output price must not be negative")
        private double outputPerMillion;

        ModelPrice toModelPrice() {
            return new ModelPrice(inputPerMillion, outputPerMillion);
        }

        public double getInputPerMillion() {
            return inputPerMillion;
        }

        public void setInputPerMillion(double inputPerMillion) {
            this.inputPerMillion = inputPerMillion;
        }

        public double getOutputPerMillion() {
            return outputPerMillion;
        }

        public void setOutputPerMillion(double outputPerMillion) {
            this.outputPerMillion = outputPerMillion;
        }
    }
}
