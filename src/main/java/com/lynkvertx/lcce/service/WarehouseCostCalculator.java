package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.config.CalculationProperties;
import com.lynkvertx.lcce.model.Material;
import com.lynkvertx.lcce.model.OperationsConfig;
import com.lynkvertx.lcce.model.WarehouseConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

import static com.lynkvertx.lcce.service.CostMath.ceil;
import static com.lynkvertx.lcce.service.CostMath.divide;
import static com.lynkvertx.lcce.service.CostMath.divideOrZero;
import static com.lynkvertx.lcce.service.CostMath.nz;
import static com.lynkvertx.lcce.service.CostMath.perPiece;

/**
 * Warehouse Cost Engine
 *
 * Storage locations = local supply locations + safety stock locations,
 * charged monthly and spread over the annual volume.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WarehouseCostCalculator {

    static final String COMPONENT = "Warehouse";

    private final CalculationProperties properties;

    public WarehouseCost calculate(Material material, WarehouseConfig warehouse, OperationsConfig operations,
                                   PackagingProfile profile, List<String> steps) {
        if (warehouse == null) {
            steps.add("Step 8: No warehouse configuration, warehouse per piece = 0");
            return WarehouseCost.empty();
        }

        BigDecimal dailyDemand = nz(material.getDailyDemand());
        BigDecimal fillPerLu = profile.getEffectiveFillQtyPerLu();
        BigDecimal leadTime = operations != null ? nz(operations.getLeadTimeDays()) : BigDecimal.ZERO;

        // Days one LU lasts at the line
        BigDecimal inventoryDays = divideOrZero(fillPerLu, dailyDemand);
        BigDecimal safetyStock = ceil(divide(leadTime.multiply(dailyDemand), fillPerLu));
        BigDecimal localLocations = inventoryDays.signum() > 0
            ? ceil(divide(properties.getLocalStorageDays(), inventoryDays))
            : properties.getLocalStorageDays();
        BigDecimal totalLocations = localLocations.add(safetyStock);

        BigDecimal annualVolume = nz(material.getAnnualVolume());
        BigDecimal costPerPiece = BigDecimal.ZERO;
        if (annualVolume.signum() > 0) {
            BigDecimal annualCost = BigDecimal.valueOf(properties.getMonthsPerYear())
                .multiply(totalLocations)
                .multiply(nz(warehouse.getCostPerLocation()));
            costPerPiece = perPiece(divide(annualCost, annualVolume), properties.getPerPieceScale());
        }
        steps.add(String.format("Step 8: Inventory days = %.2f, locations = %s local + %s safety = %s, warehouse per piece = %s",
            inventoryDays.doubleValue(), localLocations, safetyStock, totalLocations, costPerPiece.toPlainString()));

        return WarehouseCost.builder()
            .inventoryDays(inventoryDays)
            .safetyStockDays(safetyStock)
            .localLocations(localLocations)
            .totalLocations(totalLocations)
            .costPerPiece(costPerPiece)
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class WarehouseCost {
        @Builder.Default private BigDecimal inventoryDays = BigDecimal.ZERO;
        /** Safety stock expressed in storage locations */
        @Builder.Default private BigDecimal safetyStockDays = BigDecimal.ZERO;
        @Builder.Default private BigDecimal localLocations = BigDecimal.ZERO;
        @Builder.Default private BigDecimal totalLocations = BigDecimal.ZERO;
        @Builder.Default private BigDecimal costPerPiece = BigDecimal.ZERO;

        public static WarehouseCost empty() {
            return WarehouseCost.builder().build();
        }
    }
}
