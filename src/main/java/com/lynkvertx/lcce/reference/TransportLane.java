package com.lynkvertx.lcce.reference;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Road freight lane with weight-bracketed prices.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@AllArgsConstructor
public class TransportLane {

    private String laneId;

    private String laneCode;

    private String originCountry;

    private String originZip;

    private String originCity;

    private String destinationCountry;

    private String destinationZip;

    private String destinationCity;

    @Builder.Default
    private List<WeightBracket> weightBrackets = new ArrayList<>();

    /** Full truck load price, null when agreed case by case */
    private BigDecimal fullTruckPrice;

    /** Fuel surcharge in percent of the base price */
    private BigDecimal fuelSurchargePercent;

    private String leadTimeGroupage;

    private String leadTimeLtl;

    private String leadTimeFtl;

    /**
     * Find the bracket for a shipment weight: the smallest bracket whose limit is not exceeded,
     * or the heaviest bracket when the shipment is heavier than all limits.
     */
    public Optional<WeightBracket> bracketFor(BigDecimal weightKg) {
        if (weightBrackets == null || weightBrackets.isEmpty()) {
            return Optional.empty();
        }
        List<WeightBracket> sorted = new ArrayList<>(weightBrackets);
        sorted.sort(Comparator.comparing(WeightBracket::getMaxWeightKg));
        for (WeightBracket bracket : sorted) {
            if (weightKg.compareTo(bracket.getMaxWeightKg()) <= 0) {
                return Optional.of(bracket);
            }
        }
        return Optional.of(sorted.get(sorted.size() - 1));
    }

    public String routeKey() {
        return originCountry + originZip + "-" + destinationCountry + destinationZip;
    }

    @Value
    @Builder
    @Jacksonized
    @AllArgsConstructor
    public static class WeightBracket {
        private BigDecimal maxWeightKg;
        private BigDecimal price;
    }
}
