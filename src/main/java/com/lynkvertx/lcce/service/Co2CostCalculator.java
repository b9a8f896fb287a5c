package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.config.CalculationProperties;
import com.lynkvertx.lcce.dto.DiagnosticType;
import com.lynkvertx.lcce.model.Co2Config;
import com.lynkvertx.lcce.model.Material;
import com.lynkvertx.lcce.model.PackagingConfig;
import com.lynkvertx.lcce.model.Supplier;
import com.lynkvertx.lcce.model.TransportMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

import static com.lynkvertx.lcce.service.CostMath.divide;
import static com.lynkvertx.lcce.service.CostMath.nz;
import static com.lynkvertx.lcce.service.CostMath.perPiece;

/**
 * CO2 Cost Engine
 *
 * emission (kg) = total tons × energy factor × distance × conversion factor,
 * where total tons = weight per LU × LUs per year / 1000.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Co2CostCalculator {

    static final String COMPONENT = "CO2";

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final CalculationProperties properties;

    public Co2Cost calculate(Material material, Supplier supplier, PackagingConfig packaging,
                             TransportMode mode, Co2Config co2, PackagingProfile profile,
                             CalculationDiagnostics diagnostics, List<String> steps) {
        if (co2 == null) {
            steps.add("Step 6: No CO2 configuration, CO2 per piece = 0");
            return Co2Cost.empty();
        }

        BigDecimal energyFactor = properties.getEnergyFactors().get(mode);
        if (energyFactor == null) {
            diagnostics.record(DiagnosticType.CONFIG_MISSING, COMPONENT, "No energy factor configured for " + mode);
            energyFactor = BigDecimal.ZERO;
        }

        BigDecimal annualVolume = nz(material.getAnnualVolume());
        BigDecimal weightPerLu = weightPerLu(material, packaging, profile);
        // LUs per year count standard logistics units, also for special packaging
        BigDecimal fillPerLu = profile.getFillQtyPerLu();
        BigDecimal totalTons = divide(weightPerLu.multiply(divide(annualVolume, fillPerLu)), THOUSAND);
        BigDecimal distance = supplier != null ? nz(supplier.getDistanceKm()) : BigDecimal.ZERO;
        BigDecimal emissionKg = totalTons.multiply(energyFactor).multiply(distance).multiply(nz(co2.getConversionFactor()));

        BigDecimal costPerPiece = BigDecimal.ZERO;
        if (annualVolume.signum() > 0) {
            BigDecimal annualCost = emissionKg.multiply(divide(nz(co2.getCostPerTon()), THOUSAND));
            costPerPiece = perPiece(divide(annualCost, annualVolume), properties.getPerPieceScale());
        }
        steps.add(String.format("Step 6: Weight per LU = %.2fkg, total = %.3ft, emission = %.3fkg CO2 (%s factor %s, %skm), CO2 per piece = %s",
            weightPerLu.doubleValue(), totalTons.doubleValue(), emissionKg.doubleValue(),
            mode, energyFactor.toPlainString(), distance.toPlainString(), costPerPiece.toPlainString()));

        return Co2Cost.builder()
            .energyFactor(energyFactor)
            .weightPerLuKg(weightPerLu)
            .totalTons(totalTons)
            .emissionKg(emissionKg)
            .costPerPiece(costPerPiece)
            .build();
    }

    /**
     * Gross weight of one LU: pieces plus the packaging of the active variant.
     */
    BigDecimal weightPerLu(Material material, PackagingConfig packaging, PackagingProfile profile) {
        BigDecimal pieceWeight = nz(material.getWeightPerPieceKg());
        BigDecimal fillBox = profile.getFillQtyBox();
        BigDecimal trayWeight = nz(profile.getTray().getUnitWeightKg());
        BigDecimal boxWeight = nz(profile.getBox().getUnitWeightKg());
        BigDecimal palletWeight = nz(profile.getPallet().getUnitWeightKg());
        BigDecimal fillTray = nz(packaging.getFillQtyTray());
        BigDecimal traysPerBox = fillTray.signum() > 0 ? divide(fillBox, fillTray) : BigDecimal.ZERO;

        switch (profile.getVariant()) {
            case INLAY_TRAY_PALLET_SIZE:
                return fillBox.multiply(pieceWeight).add(traysPerBox.multiply(trayWeight)).add(boxWeight);
            case INLAY_TRAY:
                return profile.getFillQtyPerLu().multiply(pieceWeight)
                    .add(traysPerBox.multiply(trayWeight)).add(palletWeight);
            case STANDALONE_TRAY:
                BigDecimal specialPallets = nz(packaging.getSpecialPalletsPerLu());
                return fillTray.multiply(nz(packaging.getTraysPerSpecialPallet())).multiply(specialPallets)
                    .multiply(pieceWeight)
                    .add(specialPallets.multiply(nz(profile.getSpecialPallet().getUnitWeightKg())));
            case NONE:
            default:
                return pieceWeight.multiply(profile.getFillQtyPerLu())
                    .add(boxWeight.multiply(profile.getBoxesPerLu()))
                    .add(palletWeight);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Co2Cost {
        @Builder.Default private BigDecimal energyFactor = BigDecimal.ZERO;
        @Builder.Default private BigDecimal weightPerLuKg = BigDecimal.ZERO;
        @Builder.Default private BigDecimal totalTons = BigDecimal.ZERO;
        @Builder.Default private BigDecimal emissionKg = BigDecimal.ZERO;
        @Builder.Default private BigDecimal costPerPiece = BigDecimal.ZERO;

        public static Co2Cost empty() {
            return Co2Cost.builder().build();
        }
    }
}
