package com.phillippitts.apiguard.service.budget;

/**
 * USD price per one million input and output units for one model.
 */
public record ModelPrice(double inputPerMillion, double outputPerMillion) {

    public ModelPrice {
        if (inputPerMillion < 0 || outputPerMillion < 0) {
            throw new IllegalArgumentException("Prices must not be negative, got: "
                    + inputPerMillion + "/" + outputPerMillion);
        }
    }

    public double cost(long inputUnits, long outputUnits) {
        return (inputUnits / 1_000_000.0) * inputPerMillion
                + (outputUnits / 1_000_000.0) * outputPerMillion;
    }
}
