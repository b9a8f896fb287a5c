package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.model.CustomsConfig;
import com.lynkvertx.lcce.model.Material;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

import static com.lynkvertx.lcce.service.CostMath.divide;
import static com.lynkvertx.lcce.service.CostMath.nz;

/**
 * Customs Cost Engine
 *
 * duty = duty rate × (piece price + transport per piece), tariff = tariff rate × piece price.
 * Using a customs preference waives both.
 */
@Slf4j
@Service
public class CustomsCostCalculator {

    static final String COMPONENT = "Customs";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public CustomsCost calculate(Material material, CustomsConfig customs, BigDecimal transportCostPerPiece,
                                 List<String> steps) {
        if (customs == null) {
            steps.add("Step 7: No customs configuration, customs per piece = 0");
            return CustomsCost.empty();
        }

        BigDecimal piecePrice = nz(material.getPiecePrice());
        BigDecimal dutyRate = nz(customs.getDutyRatePercent());
        BigDecimal tariffRate = nz(customs.getTariffRatePercent());

        BigDecimal duty = BigDecimal.ZERO;
        if (dutyRate.signum() > 0) {
            duty = divide(dutyRate, HUNDRED).multiply(piecePrice.add(nz(transportCostPerPiece)));
        }
        BigDecimal tariff = BigDecimal.ZERO;
        if (tariffRate.signum() > 0) {
            tariff = divide(tariffRate, HUNDRED).multiply(piecePrice);
        }

        BigDecimal costPerPiece = customs.isPreferenceUsage() ? BigDecimal.ZERO : duty.add(tariff);
        steps.add(String.format("Step 7: Duty %s%% = %s, tariff %s%% = %s, preference used = %s, customs per piece = %s",
            dutyRate.toPlainString(), duty.toPlainString(), tariffRate.toPlainString(), tariff.toPlainString(),
            customs.isPreferenceUsage(), costPerPiece.toPlainString()));

        return CustomsCost.builder()
            .dutyRatePercent(dutyRate)
            .tariffRatePercent(tariffRate)
            .dutyPerPiece(duty)
            .tariffPerPiece(tariff)
            .preferenceUsed(customs.isPreferenceUsage())
            .costPerPiece(costPerPiece)
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CustomsCost {
        @Builder.Default private BigDecimal dutyRatePercent = BigDecimal.ZERO;
        @Builder.Default private BigDecimal tariffRatePercent = BigDecimal.ZERO;
        @Builder.Default private BigDecimal dutyPerPiece = BigDecimal.ZERO;
        @Builder.Default private BigDecimal tariffPerPiece = BigDecimal.ZERO;
        private boolean preferenceUsed;
        @Builder.Default private BigDecimal costPerPiece = BigDecimal.ZERO;

        public static CustomsCost empty() {
            return CustomsCost.builder().build();
        }
    }
}
