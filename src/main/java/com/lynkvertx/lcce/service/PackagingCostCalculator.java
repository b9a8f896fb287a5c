package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.config.CalculationProperties;
import com.lynkvertx.lcce.dto.DiagnosticType;
import com.lynkvertx.lcce.model.Material;
import com.lynkvertx.lcce.model.OperationsConfig;
import com.lynkvertx.lcce.model.PackagingConfig;
import com.lynkvertx.lcce.model.PalletAccessory;
import com.lynkvertx.lcce.model.SpecialPackagingVariant;
import com.lynkvertx.lcce.model.Supplier;
import com.lynkvertx.lcce.reference.PackagingItem;
import com.lynkvertx.lcce.reference.ReferenceLookupService;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static com.lynkvertx.lcce.service.CostMath.ceil;
import static com.lynkvertx.lcce.service.CostMath.ceilToMultiple;
import static com.lynkvertx.lcce.service.CostMath.divide;
import static com.lynkvertx.lcce.service.CostMath.nz;
import static com.lynkvertx.lcce.service.CostMath.perPiece;

/**
 * Packaging Cost Engine
 *
 * Sizes the returnable packaging pool for two phases of the loop:
 * the plant phase (boxes and pallets circulating between supplier and plant) and the
 * CoC phase (boxes held at the sub-supplier plus special packaging trays, pallets and covers).
 * The total pool cost, plus scrapping allowances, is amortized over the lifetime volume.
 *
 * The resolved {@link PackagingProfile} is shared with the transport, CO2 and warehouse engines.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PackagingCostCalculator {

    static final String COMPONENT = "Packaging";

    private final ReferenceLookupService referenceLookup;
    private final CalculationProperties properties;

    /**
     * Resolve catalog entries and fill quantities of a packaging configuration.
     * Catalog misses are recorded and replaced by an empty item, zero denominators are floored at 1.
     */
    public PackagingProfile profile(PackagingConfig packaging, OperationsConfig operations,
                                    CalculationDiagnostics diagnostics) {
        SpecialPackagingVariant variant = packaging.effectiveVariant();

        PackagingItem box = resolve(packaging.getBoxType() == null ? Optional.empty()
                : referenceLookup.box(packaging.getBoxType()),
            "box type " + packaging.getBoxType(), diagnostics);
        PackagingItem pallet = resolve(packaging.getPalletType() == null ? Optional.empty()
                : referenceLookup.pallet(packaging.getPalletType()),
            "pallet type " + packaging.getPalletType(), diagnostics);

        PackagingItem tray = PackagingItem.EMPTY;
        if (packaging.isSpecialPackagingNeeded()) {
            tray = resolve(referenceLookup.tray(variant), "tray for " + variant, diagnostics);
        }
        PackagingItem specialPallet = PackagingItem.EMPTY;
        PackagingItem cover = PackagingItem.EMPTY;
        boolean additional = packaging.isSpecialPackagingNeeded() && packaging.isAdditionalSpecialPackagingNeeded();
        if (additional || variant == SpecialPackagingVariant.STANDALONE_TRAY) {
            specialPallet = resolve(referenceLookup.accessory(PalletAccessory.SPECIAL_PALLET),
                "special pallet", diagnostics);
        }
        if (additional) {
            cover = resolve(referenceLookup.accessory(PalletAccessory.COVER), "pallet cover", diagnostics);
        }

        BigDecimal fillQtyBox = diagnostics.atLeastOne(packaging.getFillQtyBox(), COMPONENT, "Fill quantity per box");
        BigDecimal boxesPerLu = diagnostics.atLeastOne(box.getUnitsPerLogisticsUnit(), COMPONENT, "Boxes per LU");
        BigDecimal fillQtyPerLu = fillQtyBox.multiply(boxesPerLu);

        BigDecimal spFillQtyPerLu = BigDecimal.ZERO;
        if (packaging.isSpecialPackagingNeeded()) {
            spFillQtyPerLu = specialFillQtyPerLu(packaging, variant, fillQtyBox, boxesPerLu, diagnostics);
        }
        BigDecimal effectiveFill = packaging.isSpecialPackagingNeeded() && spFillQtyPerLu.signum() > 0
            ? spFillQtyPerLu
            : fillQtyPerLu;

        BigDecimal loopDays = packaging.getLoopStages() != null
            ? BigDecimal.valueOf(packaging.getLoopStages().totalDays())
            : BigDecimal.ZERO;
        int subSupplierDays = operations != null ? operations.effectiveSubSupplierBoxDays() : 0;

        return PackagingProfile.builder()
            .box(box)
            .pallet(pallet)
            .tray(tray)
            .specialPallet(specialPallet)
            .cover(cover)
            .specialPackaging(packaging.isSpecialPackagingNeeded())
            .variant(variant)
            .fillQtyBox(fillQtyBox)
            .boxesPerLu(boxesPerLu)
            .fillQtyPerLu(fillQtyPerLu)
            .overseaFillQty(nz(packaging.getFillQtyLuOversea()))
            .spFillQtyPerLu(spFillQtyPerLu)
            .effectiveFillQtyPerLu(effectiveFill)
            .loopDays(loopDays)
            .cocLoopDays(loopDays.add(BigDecimal.valueOf(subSupplierDays)))
            .build();
    }

    /**
     * Pieces per LU of the special packaging variant:
     * InlayTrayPalletSize = fill box / fill tray², InlayTray = fill box × boxes per LU,
     * StandaloneTray = fill tray × trays per special pallet × special pallets per LU.
     */
    private BigDecimal specialFillQtyPerLu(PackagingConfig packaging, SpecialPackagingVariant variant,
                                           BigDecimal fillQtyBox, BigDecimal boxesPerLu,
                                           CalculationDiagnostics diagnostics) {
        switch (variant) {
            case INLAY_TRAY_PALLET_SIZE:
                BigDecimal fillTray = diagnostics.atLeastOne(packaging.getFillQtyTray(), COMPONENT, "Fill quantity per tray");
                return divide(fillQtyBox, fillTray.multiply(fillTray));
            case INLAY_TRAY:
                return fillQtyBox.multiply(boxesPerLu);
            case STANDALONE_TRAY:
                return nz(packaging.getFillQtyTray())
                    .multiply(nz(packaging.getTraysPerSpecialPallet()))
                    .multiply(nz(packaging.getSpecialPalletsPerLu()));
            case NONE:
            default:
                return BigDecimal.ZERO;
        }
    }

    /**
     * Calculate packaging cost for one pair.
     *
     * @param lifetimeVolume annual volume × lifetime years
     * @param steps          calculation steps (mutated)
     */
    public PackagingCost calculate(Material material, Supplier supplier, PackagingConfig packaging,
                                   OperationsConfig operations, PackagingProfile profile,
                                   BigDecimal lifetimeVolume, CalculationDiagnostics diagnostics,
                                   List<String> steps) {
        BigDecimal dailyDemand = nz(material.getDailyDemand());
        BigDecimal fillBox = profile.getFillQtyBox();
        BigDecimal boxesPerLu = profile.getBoxesPerLu();
        BigDecimal boxPrice = nz(profile.getBox().getUnitPrice());
        BigDecimal palletPrice = nz(profile.getPallet().getUnitPrice());

        // Plant phase
        BigDecimal plantBoxes = ceilToMultiple(
            divide(dailyDemand.multiply(profile.getLoopDays()), fillBox),
            BigDecimal.valueOf(properties.getPlantBoxRoundingMultiple()));
        BigDecimal plantLus = ceil(divide(plantBoxes, boxesPerLu));
        BigDecimal plantCost = plantBoxes.multiply(boxPrice.add(nz(packaging.getAdditionalPackagingPrice())))
            .add(plantLus.multiply(palletPrice));
        steps.add(String.format("Step 1: Plant loop = %s days, boxes = ceil10(%s × %s / %s) = %s, LUs = %s, cost = %.2f",
            profile.getLoopDays(), dailyDemand, profile.getLoopDays(), fillBox,
            plantBoxes, plantLus, plantCost.doubleValue()));

        // CoC phase
        BigDecimal subSupplierDays = BigDecimal.valueOf(operations != null ? operations.effectiveSubSupplierBoxDays() : 0);
        BigDecimal cocBoxes = divide(dailyDemand.multiply(subSupplierDays), fillBox);
        BigDecimal cocLus = ceil(divide(cocBoxes, boxesPerLu));
        BigDecimal cocTrays = BigDecimal.ZERO;
        BigDecimal cocCovers = BigDecimal.ZERO;
        BigDecimal tooling = BigDecimal.ZERO;
        if (profile.isSpecialPackaging()) {
            BigDecimal trayLoop = diagnostics.atLeastOne(
                nz(packaging.getFillQtyTray()).multiply(profile.getCocLoopDays()), COMPONENT, "Fill quantity per tray × CoC loop days");
            cocTrays = ceil(divide(dailyDemand, trayLoop));
            if (packaging.isAdditionalSpecialPackagingNeeded()) {
                BigDecimal traysPerPallet = diagnostics.atLeastOne(packaging.getTraysPerSpecialPallet(),
                    COMPONENT, "Trays per special pallet");
                cocCovers = ceil(divide(cocTrays, traysPerPallet));
            }
            tooling = nz(packaging.getToolingCost());
        }
        BigDecimal cocCost = cocBoxes.multiply(boxPrice)
            .add(cocLus.multiply(palletPrice))
            .add(cocTrays.multiply(nz(profile.getTray().getUnitPrice())))
            .add(cocCovers.multiply(nz(profile.getSpecialPallet().getUnitPrice()).add(nz(profile.getCover().getUnitPrice()))))
            .add(tooling);
        steps.add(String.format("Step 2: CoC loop = %s days, boxes = %.2f, LUs = %s, trays = %s, pallet covers = %s, tooling = %.2f, cost = %.2f",
            profile.getCocLoopDays(), cocBoxes.doubleValue(), cocLus, cocTrays, cocCovers,
            tooling.doubleValue(), cocCost.doubleValue()));

        BigDecimal totalCost = plantCost.add(cocCost);

        // Scrapping allowances
        BigDecimal scrapCardboard = nz(packaging.getEmptiesScrapCardboard());
        BigDecimal scrapWood = BigDecimal.ZERO;
        if (profile.getBox().isWood()) {
            scrapWood = divide(nz(material.getAnnualVolume()), fillBox)
                .multiply(nz(profile.getBox().getUnitWeightKg()))
                .multiply(properties.getWoodScrapFactor());
        }

        BigDecimal costPerPiece = BigDecimal.ZERO;
        if (lifetimeVolume.signum() > 0) {
            costPerPiece = perPiece(divide(scrapCardboard.add(scrapWood).add(totalCost), lifetimeVolume),
                properties.getPerPieceScale());
        }
        steps.add(String.format("Step 3: Packaging per piece = (%.2f + %.2f + %.2f) / %s = %s",
            scrapCardboard.doubleValue(), scrapWood.doubleValue(), totalCost.doubleValue(),
            lifetimeVolume.toPlainString(), costPerPiece.toPlainString()));

        BigDecimal moq = minimumOrderQuantity(material, supplier, packaging, profile, diagnostics);

        log.debug("Packaging: plant={}, coc={}, perPiece={}, moq={}", plantCost, cocCost, costPerPiece, moq);

        return PackagingCost.builder()
            .loopDays(profile.getLoopDays())
            .cocLoopDays(profile.getCocLoopDays())
            .plantBoxes(plantBoxes)
            .plantLogisticsUnits(plantLus)
            .plantCost(plantCost)
            .cocBoxes(cocBoxes)
            .cocLogisticsUnits(cocLus)
            .cocTrays(cocTrays)
            .cocPalletCovers(cocCovers)
            .cocCost(cocCost)
            .totalCost(totalCost)
            .scrapCardboard(scrapCardboard)
            .scrapWood(scrapWood)
            .costPerPiece(costPerPiece)
            .minimumOrderQuantity(moq)
            .build();
    }

    /**
     * Demand per delivery rounded up to whole layers of boxes,
     * or to whole special pallets for standalone trays.
     */
    BigDecimal minimumOrderQuantity(Material material, Supplier supplier, PackagingConfig packaging,
                                    PackagingProfile profile, CalculationDiagnostics diagnostics) {
        BigDecimal deliveries = diagnostics.atLeastOne(
            supplier != null ? supplier.getDeliveriesPerMonth() : null, COMPONENT, "Deliveries per month");
        BigDecimal demandPerDelivery = divide(
            nz(material.getDailyDemand()).multiply(BigDecimal.valueOf(properties.getDaysPerMonth())), deliveries);

        BigDecimal packingUnit;
        if (profile.getVariant() == SpecialPackagingVariant.STANDALONE_TRAY) {
            packingUnit = nz(packaging.getFillQtyTray()).multiply(nz(packaging.getTraysPerSpecialPallet()));
        } else {
            BigDecimal boxesPerLayer = nz(profile.getBox().getUnitsPerLayer());
            packingUnit = profile.getFillQtyBox().multiply(boxesPerLayer.signum() > 0 ? boxesPerLayer : BigDecimal.ONE);
        }
        return ceilToMultiple(demandPerDelivery, packingUnit);
    }

    private PackagingItem resolve(Optional<PackagingItem> item, String what, CalculationDiagnostics diagnostics) {
        if (item.isPresent()) {
            return item.get();
        }
        diagnostics.record(DiagnosticType.LOOKUP_MISS, COMPONENT, "No catalog entry for " + what);
        return PackagingItem.EMPTY;
    }

    /**
     * Packaging figures of one pair
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PackagingCost {
        @Builder.Default private BigDecimal loopDays = BigDecimal.ZERO;
        @Builder.Default private BigDecimal cocLoopDays = BigDecimal.ZERO;
        @Builder.Default private BigDecimal plantBoxes = BigDecimal.ZERO;
        @Builder.Default private BigDecimal plantLogisticsUnits = BigDecimal.ZERO;
        @Builder.Default private BigDecimal plantCost = BigDecimal.ZERO;
        @Builder.Default private BigDecimal cocBoxes = BigDecimal.ZERO;
        @Builder.Default private BigDecimal cocLogisticsUnits = BigDecimal.ZERO;
        @Builder.Default private BigDecimal cocTrays = BigDecimal.ZERO;
        @Builder.Default private BigDecimal cocPalletCovers = BigDecimal.ZERO;
        @Builder.Default private BigDecimal cocCost = BigDecimal.ZERO;
        @Builder.Default private BigDecimal totalCost = BigDecimal.ZERO;
        @Builder.Default private BigDecimal scrapCardboard = BigDecimal.ZERO;
        @Builder.Default private BigDecimal scrapWood = BigDecimal.ZERO;
        @Builder.Default private BigDecimal costPerPiece = BigDecimal.ZERO;
        @Builder.Default private BigDecimal minimumOrderQuantity = BigDecimal.ZERO;

        public static PackagingCost empty() {
            return PackagingCost.builder().build();
        }
    }
}
