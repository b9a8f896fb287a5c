package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.config.CalculationProperties;
import com.lynkvertx.lcce.dto.CostCalculationRequestDTO;
import com.lynkvertx.lcce.dto.CostCalculationResultDTO;
import com.lynkvertx.lcce.model.Location;
import com.lynkvertx.lcce.model.Material;
import com.lynkvertx.lcce.model.TransportConfig;
import com.lynkvertx.lcce.service.Co2CostCalculator.Co2Cost;
import com.lynkvertx.lcce.service.CustomsCostCalculator.CustomsCost;
import com.lynkvertx.lcce.service.PackagingCostCalculator.PackagingCost;
import com.lynkvertx.lcce.service.RepackingCostCalculator.RepackingCost;
import com.lynkvertx.lcce.service.TransportCostCalculator.TransportCost;
import com.lynkvertx.lcce.service.WarehouseCostCalculator.WarehouseCost;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Total Cost Aggregator
 *
 * Runs all cost engines for one material-supplier pair in dependency order:
 * 1. Volume model
 * 2. Packaging profile and packaging cost
 * 3. Repacking
 * 4. Transport (feeds customs)
 * 5. CO2
 * 6. Customs
 * 7. Warehouse
 * 8. Additional costs
 *
 * Every engine runs behind {@link CalculationDiagnostics#guard}, so a failing component
 * contributes zero and a diagnostic instead of aborting the pair.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LogisticsCostCalculationService {

    private final VolumeCalculator volumeCalculator;
    private final PackagingCostCalculator packagingCalculator;
    private final RepackingCostCalculator repackingCalculator;
    private final TransportCostCalculator transportCalculator;
    private final Co2CostCalculator co2Calculator;
    private final CustomsCostCalculator customsCalculator;
    private final WarehouseCostCalculator warehouseCalculator;
    private final AdditionalCostCalculator additionalCalculator;
    private final CalculationProperties properties;

    /**
     * Names of the required configuration records absent from a pair.
     */
    public List<String> missingConfigs(CostCalculationRequestDTO request) {
        List<String> missing = new ArrayList<>();
        if (request.getMaterial() == null) {
            missing.add("Material");
        }
        if (request.getSupplier() == null) {
            missing.add("Supplier");
        }
        if (request.getPackaging() == null) {
            missing.add("PackagingConfig");
        }
        if (request.getTransport() == null) {
            missing.add("TransportConfig");
        }
        return missing;
    }

    /**
     * Calculate the logistics cost of one pair.
     *
     * @throws IllegalArgumentException if material, supplier, packaging or transport configuration is missing
     */
    public CostCalculationResultDTO calculate(CostCalculationRequestDTO request) {
        List<String> missing = missingConfigs(request);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException(String.format("Missing configuration for %s: %s",
                request.pairLabel(), String.join(", ", missing)));
        }
        return calculate(request, new CalculationDiagnostics(request.pairLabel()));
    }

    CostCalculationResultDTO calculate(CostCalculationRequestDTO request, CalculationDiagnostics diagnostics) {
        List<String> steps = new ArrayList<>();
        Material material = request.getMaterial();
        TransportConfig transport = request.getTransport();
        Location destination = request.getLocation() != null ? request.getLocation() : properties.getDefaultLocation();

        // Volume model
        BigDecimal annualVolume = volumeCalculator.annualVolume(material);
        BigDecimal lifetimeVolume = volumeCalculator.lifetimeVolume(material);
        steps.add(String.format("Step 0: Lifetime volume = %s pcs/year × %s years = %s pcs",
            annualVolume.toPlainString(), CostMath.nz(material.getLifetimeYears()).toPlainString(),
            lifetimeVolume.toPlainString()));

        // Packaging
        PackagingProfile profile = diagnostics.guard(PackagingCostCalculator.COMPONENT,
            () -> packagingCalculator.profile(request.getPackaging(), request.getOperations(), diagnostics),
            PackagingProfile::empty);
        PackagingCost packaging = diagnostics.guard(PackagingCostCalculator.COMPONENT,
            () -> packagingCalculator.calculate(material, request.getSupplier(), request.getPackaging(),
                request.getOperations(), profile, lifetimeVolume, diagnostics, steps),
            PackagingCost::empty);

        RepackingCost repacking = diagnostics.guard(RepackingCostCalculator.COMPONENT,
            () -> repackingCalculator.calculate(material, request.getRepacking(), diagnostics, steps),
            RepackingCost::empty);

        TransportCost transportCost = diagnostics.guard(TransportCostCalculator.COMPONENT,
            () -> transportCalculator.calculate(material, request.getSupplier(), destination, transport,
                request.getOperations(), profile, diagnostics, steps),
            TransportCost::empty);

        Co2Cost co2 = diagnostics.guard(Co2CostCalculator.COMPONENT,
            () -> co2Calculator.calculate(material, request.getSupplier(), request.getPackaging(),
                transport.getMode(), request.getCo2(), profile, diagnostics, steps),
            Co2Cost::empty);

        CustomsCost customs = diagnostics.guard(CustomsCostCalculator.COMPONENT,
            () -> customsCalculator.calculate(material, request.getCustoms(), transportCost.getCostPerPiece(), steps),
            CustomsCost::empty);

        WarehouseCost warehouse = diagnostics.guard(WarehouseCostCalculator.COMPONENT,
            () -> warehouseCalculator.calculate(material, request.getWarehouse(), request.getOperations(), profile, steps),
            WarehouseCost::empty);

        BigDecimal additional = diagnostics.guard(AdditionalCostCalculator.COMPONENT,
            () -> additionalCalculator.costPerPiece(request.getAdditionalCosts(), lifetimeVolume, steps),
            () -> BigDecimal.ZERO);

        BigDecimal totalPerPiece = packaging.getCostPerPiece()
            .add(repacking.getCostPerPiece())
            .add(customs.getCostPerPiece())
            .add(transportCost.getCostPerPiece())
            .add(warehouse.getCostPerPiece())
            .add(additional)
            .add(co2.getCostPerPiece());
        BigDecimal totalAnnual = totalPerPiece.multiply(annualVolume);
        steps.add(String.format("Step 10: Total per piece = %s, total per year = %.2f",
            totalPerPiece.toPlainString(), totalAnnual.doubleValue()));

        log.info("Calculated {}: {} per piece, {} per year, {} diagnostics",
            request.pairLabel(), totalPerPiece.toPlainString(), totalAnnual.toPlainString(),
            diagnostics.getEntries().size());

        return CostCalculationResultDTO.builder()
            .materialNo(material.getMaterialNo())
            .materialDescription(material.getDescription())
            .vendorId(request.getSupplier().getVendorId())
            .supplierName(request.getSupplier().getName())
            .supplierCountry(request.getSupplier().getCountry())
            .destinationPlant(destination != null ? destination.getPlant() : null)
            .annualVolume(annualVolume)
            .lifetimeVolume(lifetimeVolume)
            .packagingLoopDays(packaging.getLoopDays())
            .cocLoopDays(packaging.getCocLoopDays())
            .fillQtyPerLu(profile.getFillQtyPerLu())
            .spFillQtyPerLu(profile.getSpFillQtyPerLu())
            .plantBoxes(packaging.getPlantBoxes())
            .plantLogisticsUnits(packaging.getPlantLogisticsUnits())
            .packagingCostPlant(packaging.getPlantCost())
            .cocBoxes(packaging.getCocBoxes())
            .cocLogisticsUnits(packaging.getCocLogisticsUnits())
            .cocTrays(packaging.getCocTrays())
            .cocPalletCovers(packaging.getCocPalletCovers())
            .packagingCostCoc(packaging.getCocCost())
            .packagingCostTotal(packaging.getTotalCost())
            .scrapWood(packaging.getScrapWood())
            .packagingCostPerPiece(packaging.getCostPerPiece())
            .minimumOrderQuantity(packaging.getMinimumOrderQuantity())
            .weightCategory(repacking.getWeightCategory() != null ? repacking.getWeightCategory().getLabel() : null)
            .repackingOperation(repacking.getOperationType())
            .repackingCostPerPiece(repacking.getCostPerPiece())
            .transportMode(transport.getMode())
            .automaticTransport(transportCost.isAutomatic())
            .transportLaneId(transportCost.getLaneId())
            .palletsPerDelivery(transportCost.getPallets())
            .shipmentWeightKg(transportCost.getShipmentWeightKg())
            .loadingMeters(transportCost.getLoadingMeters())
            .transportPricePerDelivery(transportCost.getTotalPrice())
            .transportCostPerLogisticsUnit(transportCost.getCostPerLogisticsUnit())
            .transportCostPerPiece(transportCost.getCostPerPiece())
            .dutyRatePercent(customs.getDutyRatePercent())
            .tariffRatePercent(customs.getTariffRatePercent())
            .dutyPerPiece(customs.getDutyPerPiece())
            .tariffPerPiece(customs.getTariffPerPiece())
            .customsCostPerPiece(customs.getCostPerPiece())
            .co2TotalTons(co2.getTotalTons())
            .co2EmissionKg(co2.getEmissionKg())
            .co2CostPerPiece(co2.getCostPerPiece())
            .inventoryDays(warehouse.getInventoryDays())
            .safetyStockDays(warehouse.getSafetyStockDays())
            .storageLocationsLocal(warehouse.getLocalLocations())
            .storageLocationsTotal(warehouse.getTotalLocations())
            .warehouseCostPerPiece(warehouse.getCostPerPiece())
            .additionalCostPerPiece(additional)
            .totalCostPerPiece(totalPerPiece)
            .totalAnnualCost(totalAnnual)
            .diagnostics(new ArrayList<>(diagnostics.getEntries()))
            .calculationSteps(steps)
            .calculatedAt(Instant.now().toString())
            .build();
    }
}
