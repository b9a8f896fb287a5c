package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.model.CustomsConfig;
import com.lynkvertx.lcce.service.CustomsCostCalculator.CustomsCost;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class CustomsCostCalculatorTest {

    private static final BigDecimal TRANSPORT_PER_PIECE = new BigDecimal("0.1");

    private final CustomsCostCalculator calculator = new CustomsCostCalculator();

    @Test
    void zeroDutyRate_costsNothing() {
        CustomsCost cost = calculate(CustomsConfig.builder().dutyRatePercent(BigDecimal.ZERO).build());

        assertThat(cost.getCostPerPiece()).isEqualByComparingTo("0");
    }

    @Test
    void duty_appliesToPiecePricePlusTransport() {
        CustomsCost cost = calculate(CustomsConfig.builder().dutyRatePercent(new BigDecimal("5")).build());

        // 5% × (2.00 + 0.1)
        assertThat(cost.getDutyPerPiece()).isEqualByComparingTo("0.105");
        assertThat(cost.getCostPerPiece()).isEqualByComparingTo("0.105");
    }

    @Test
    void tariff_appliesToPiecePriceOnly() {
        CustomsCost cost = calculate(CustomsConfig.builder()
            .dutyRatePercent(new BigDecimal("5"))
            .tariffRatePercent(new BigDecimal("10"))
            .build());

        assertThat(cost.getTariffPerPiece()).isEqualByComparingTo("0.2");
        assertThat(cost.getCostPerPiece()).isEqualByComparingTo("0.305");
    }

    @Test
    void preferenceUsage_waivesDutyAndTariff() {
        CustomsCost cost = calculate(CustomsConfig.builder()
            .preferenceUsage(true)
            .dutyRatePercent(new BigDecimal("12"))
            .tariffRatePercent(new BigDecimal("25"))
            .build());

        assertThat(cost.getCostPerPiece()).isEqualByComparingTo("0");
        assertThat(cost.isPreferenceUsed()).isTrue();
        assertThat(cost.getDutyPerPiece()).isEqualByComparingTo("0.252");
    }

    @Test
    void noCustomsConfig_costsNothing() {
        assertThat(calculate(null).getCostPerPiece()).isEqualByComparingTo("0");
    }

    private CustomsCost calculate(CustomsConfig customs) {
        return calculator.calculate(CalculationFixtures.material(), customs, TRANSPORT_PER_PIECE, new ArrayList<>());
    }
}
