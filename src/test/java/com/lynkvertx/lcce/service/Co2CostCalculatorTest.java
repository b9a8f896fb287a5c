package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.model.Co2Config;
import com.lynkvertx.lcce.model.Material;
import com.lynkvertx.lcce.model.PackagingConfig;
import com.lynkvertx.lcce.model.SpecialPackagingVariant;
import com.lynkvertx.lcce.model.TransportMode;
import com.lynkvertx.lcce.service.Co2CostCalculator.Co2Cost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class Co2CostCalculatorTest {

    private Co2CostCalculator calculator;
    private PackagingCostCalculator packagingCalculator;
    private CalculationDiagnostics diagnostics;

    @BeforeEach
    void setUp() {
        calculator = new Co2CostCalculator(CalculationFixtures.properties());
        packagingCalculator = new PackagingCostCalculator(CalculationFixtures.lookup(), CalculationFixtures.properties());
        diagnostics = CalculationFixtures.diagnostics();
    }

    @Test
    void road_standardPackaging() {
        Co2Cost cost = calculate(CalculationFixtures.material(), CalculationFixtures.packaging(), TransportMode.ROAD);

        // 0.5 × 1000 + 1.5 × 20 + 25
        assertThat(cost.getWeightPerLuKg()).isEqualByComparingTo("555");
        // 555 × 120 LUs / 1000
        assertThat(cost.getTotalTons()).isEqualByComparingTo("66.6");
        assertThat(cost.getEnergyFactor()).isEqualByComparingTo("0.04415");
        // 66.6 × 0.04415 × 220 × 3.17
        assertThat(cost.getEmissionKg()).isEqualByComparingTo("2050.627986");
        // 2050.63 × 0.1 / 120,000 = 0.0017 → 0.002
        assertThat(cost.getCostPerPiece()).isEqualByComparingTo("0.002");
    }

    @Test
    void energyFactor_dependsOnMode() {
        assertThat(calculate(CalculationFixtures.material(), CalculationFixtures.packaging(), TransportMode.SEA)
            .getEnergyFactor()).isEqualByComparingTo("0.006");
        assertThat(calculate(CalculationFixtures.material(), CalculationFixtures.packaging(), TransportMode.RAIL)
            .getEnergyFactor()).isEqualByComparingTo("0.0085");
    }

    @Test
    void weightPerLu_followsSpecialPackagingVariant() {
        Material material = CalculationFixtures.material();

        // 1000 × 0.5 + (50 / 10) × 0.3 + 25
        assertThat(weightPerLu(material, special(SpecialPackagingVariant.INLAY_TRAY))).isEqualByComparingTo("526.5");
        // 50 × 0.5 + (50 / 10) × 2.5 + 1.5
        assertThat(weightPerLu(material, special(SpecialPackagingVariant.INLAY_TRAY_PALLET_SIZE))).isEqualByComparingTo("39");
        // 10 × 20 × 2 × 0.5 + 2 × 20
        assertThat(weightPerLu(material, special(SpecialPackagingVariant.STANDALONE_TRAY))).isEqualByComparingTo("240");
    }

    @Test
    void totalTons_countsStandardLogisticsUnitsForEverySpecialVariant() {
        Material material = CalculationFixtures.material();

        // 120,000 pcs / 1000 pcs per LU = 120 LUs per year
        assertThat(calculate(material, special(SpecialPackagingVariant.INLAY_TRAY), TransportMode.ROAD)
            .getTotalTons()).isEqualByComparingTo("63.18");
        assertThat(calculate(material, special(SpecialPackagingVariant.INLAY_TRAY_PALLET_SIZE), TransportMode.ROAD)
            .getTotalTons()).isEqualByComparingTo("4.68");
        assertThat(calculate(material, special(SpecialPackagingVariant.STANDALONE_TRAY), TransportMode.ROAD)
            .getTotalTons()).isEqualByComparingTo("28.8");
    }

    @Test
    void specialPackaging_tonsNeverExceedShippedGrossWeight() {
        Co2Cost cost = calculate(CalculationFixtures.material(),
            special(SpecialPackagingVariant.INLAY_TRAY_PALLET_SIZE), TransportMode.ROAD);

        // 60 t of parts per year
        assertThat(cost.getTotalTons()).isLessThan(new BigDecimal("60"));
        assertThat(cost.getCostPerPiece()).isEqualByComparingTo("0.001");
    }

    @Test
    void zeroAnnualVolume_costsNothing() {
        Material material = CalculationFixtures.material();
        material.setAnnualVolume(0L);

        Co2Cost cost = calculate(material, CalculationFixtures.packaging(), TransportMode.ROAD);

        assertThat(cost.getCostPerPiece()).isEqualByComparingTo("0");
    }

    @Test
    void noCo2Config_costsNothing() {
        PackagingConfig packaging = CalculationFixtures.packaging();
        PackagingProfile profile = packagingCalculator.profile(packaging, null, diagnostics);

        Co2Cost cost = calculator.calculate(CalculationFixtures.material(), CalculationFixtures.supplier(), packaging,
            TransportMode.ROAD, null, profile, diagnostics, new ArrayList<>());

        assertThat(cost.getCostPerPiece()).isEqualByComparingTo("0");
        assertThat(cost.getEmissionKg()).isEqualByComparingTo("0");
    }

    private Co2Cost calculate(Material material, PackagingConfig packaging, TransportMode mode) {
        PackagingProfile profile = packagingCalculator.profile(packaging, null, diagnostics);
        Co2Config co2 = Co2Config.builder()
            .costPerTon(new BigDecimal("100"))
            .conversionFactor(new BigDecimal("3.17"))
            .build();
        return calculator.calculate(material, CalculationFixtures.supplier(), packaging, mode, co2, profile,
            diagnostics, new ArrayList<>());
    }

    private BigDecimal weightPerLu(Material material, PackagingConfig packaging) {
        return calculator.weightPerLu(material, packaging, packagingCalculator.profile(packaging, null, diagnostics));
    }

    private static PackagingConfig special(SpecialPackagingVariant variant) {
        PackagingConfig packaging = CalculationFixtures.packaging();
        packaging.setSpecialPackagingNeeded(true);
        packaging.setSpecialPackagingVariant(variant);
        packaging.setFillQtyTray(10);
        packaging.setTraysPerSpecialPallet(20);
        packaging.setSpecialPalletsPerLu(2);
        return packaging;
    }
}
