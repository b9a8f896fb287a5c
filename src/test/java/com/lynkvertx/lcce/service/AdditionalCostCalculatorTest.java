package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.model.AdditionalCost;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AdditionalCostCalculatorTest {

    private final AdditionalCostCalculator calculator = new AdditionalCostCalculator();
    private final VolumeCalculator volumeCalculator = new VolumeCalculator();

    @Test
    void sumIsSpreadOverLifetimeVolume() {
        List<AdditionalCost> costs = List.of(
            new AdditionalCost("Audit", new BigDecimal("1200")),
            new AdditionalCost("Labels", new BigDecimal("300")));
        BigDecimal lifetimeVolume = volumeCalculator.lifetimeVolume(CalculationFixtures.material());

        assertThat(lifetimeVolume).isEqualByComparingTo("600000");
        assertThat(calculator.costPerPiece(costs, lifetimeVolume, new ArrayList<>())).isEqualByComparingTo("0.0025");
    }

    @Test
    void zeroLifetimeVolume_costsNothing() {
        List<AdditionalCost> costs = List.of(new AdditionalCost("Audit", new BigDecimal("1200")));

        assertThat(calculator.costPerPiece(costs, BigDecimal.ZERO, new ArrayList<>())).isEqualByComparingTo("0");
    }

    @Test
    void noAdditionalCosts_costsNothing() {
        assertThat(calculator.costPerPiece(null, new BigDecimal("600000"), new ArrayList<>())).isEqualByComparingTo("0");
    }
}
