package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.config.CalculationProperties;
import com.lynkvertx.lcce.dto.DiagnosticType;
import com.lynkvertx.lcce.model.Incoterm;
import com.lynkvertx.lcce.model.Location;
import com.lynkvertx.lcce.model.Material;
import com.lynkvertx.lcce.model.OperationsConfig;
import com.lynkvertx.lcce.model.Supplier;
import com.lynkvertx.lcce.model.TransportConfig;
import com.lynkvertx.lcce.model.TransportMode;
import com.lynkvertx.lcce.reference.ReferenceLookupService;
import com.lynkvertx.lcce.reference.TransportLane;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

import static com.lynkvertx.lcce.service.CostMath.ceil;
import static com.lynkvertx.lcce.service.CostMath.divide;
import static com.lynkvertx.lcce.service.CostMath.divideOrZero;
import static com.lynkvertx.lcce.service.CostMath.max0;
import static com.lynkvertx.lcce.service.CostMath.nz;

/**
 * Transport Cost Engine
 *
 * Manual mode divides the agreed cost per LU by the pieces per LU.
 * Automatic mode prices one delivery from the transport lane table:
 * 1. Unit weight and demand per delivery
 * 2. Pallets, shipment weight and loading meters
 * 3. Lane identification by country and zip prefix
 * 4. Weight / space / full truck pricing plus fuel surcharge
 * 5. Price per piece
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransportCostCalculator {

    static final String COMPONENT = "Transport";

    private final ReferenceLookupService referenceLookup;
    private final CalculationProperties properties;

    public TransportCost calculate(Material material, Supplier supplier, Location destination,
                                   TransportConfig transport, OperationsConfig operations,
                                   PackagingProfile profile, CalculationDiagnostics diagnostics,
                                   List<String> steps) {
        if (transport.isAutomaticCalculation()) {
            return automatic(material, supplier, destination, transport, operations, profile, diagnostics, steps);
        }
        return manual(transport, operations, profile, diagnostics, steps);
    }

    /**
     * Sea freight under FCA / FOB carries the bonded warehouse leg on top of the sea leg.
     */
    TransportCost manual(TransportConfig transport, OperationsConfig operations, PackagingProfile profile,
                         CalculationDiagnostics diagnostics, List<String> steps) {
        BigDecimal costPerLu = nz(transport.getCostPerLu());
        BigDecimal standardFill = profile.getFillQtyPerLu();
        BigDecimal costPerPiece;

        if (transport.getMode() == TransportMode.SEA) {
            BigDecimal overseaFill = diagnostics.atLeastOne(profile.getOverseaFillQty(), COMPONENT, "Overseas fill quantity per LU");
            costPerPiece = divide(costPerLu, overseaFill);
            if (isBondedIncoterm(operations)) {
                costPerPiece = costPerPiece.add(divide(nz(transport.getCostBondedPerLu()), standardFill));
            }
            steps.add(String.format("Step 5: Sea transport (%s): %.2f / %s%s = %s per piece",
                incoterm(operations), costPerLu.doubleValue(), overseaFill,
                isBondedIncoterm(operations)
                    ? String.format(" + bonded %.2f / %s", nz(transport.getCostBondedPerLu()).doubleValue(), standardFill)
                    : "",
                costPerPiece.toPlainString()));
        } else {
            costPerPiece = divide(costPerLu, standardFill);
            steps.add(String.format("Step 5: %s transport: %.2f / %s = %s per piece",
                transport.getMode(), costPerLu.doubleValue(), standardFill, costPerPiece.toPlainString()));
        }

        return TransportCost.builder()
            .automatic(false)
            .costPerLogisticsUnit(costPerLu)
            .costPerPiece(max0(costPerPiece))
            .build();
    }

    TransportCost automatic(Material material, Supplier supplier, Location destination,
                            TransportConfig transport, OperationsConfig operations,
                            PackagingProfile profile, CalculationDiagnostics diagnostics,
                            List<String> steps) {
        // Step 1: unit weight and demand per delivery
        BigDecimal piecesPerUnit = profile.getFillQtyBox();
        BigDecimal unitWeight = nz(material.getWeightPerPieceKg()).multiply(piecesPerUnit)
            .add(nz(profile.getBox().getUnitWeightKg()));
        BigDecimal deliveries = diagnostics.atLeastOne(supplier.getDeliveriesPerMonth(), COMPONENT, "Deliveries per month");
        BigDecimal demandPerDelivery = divide(
            nz(material.getDailyDemand()).multiply(BigDecimal.valueOf(properties.getDaysPerMonth())), deliveries);
        BigDecimal unitsPerDelivery = divide(demandPerDelivery, piecesPerUnit);
        steps.add(String.format("Step 5.1: Unit weight = %.3fkg, demand per delivery = %.2f pcs, units per delivery = %.2f",
            unitWeight.doubleValue(), demandPerDelivery.doubleValue(), unitsPerDelivery.doubleValue()));

        // Step 2: logistics units
        BigDecimal unitsPerPallet = profile.getBoxesPerLu();
        BigDecimal pallets = ceil(divide(unitsPerDelivery, unitsPerPallet));
        BigDecimal weightPerPallet = unitsPerPallet.multiply(unitWeight).add(nz(profile.getPallet().getUnitWeightKg()));
        BigDecimal shipmentWeight = pallets.multiply(weightPerPallet);
        BigDecimal stackability = diagnostics.atLeastOne(transport.getStackabilityFactor(), COMPONENT, "Stackability factor");
        BigDecimal loadingMeters = divide(pallets, stackability).multiply(properties.getPalletFootprintLdm());
        steps.add(String.format("Step 5.2: Pallets = %s, weight per pallet = %.2fkg, shipment = %.2fkg, loading meters = %.2f",
            pallets, weightPerPallet.doubleValue(), shipmentWeight.doubleValue(), loadingMeters.doubleValue()));

        TransportCost.TransportCostBuilder result = TransportCost.builder()
            .automatic(true)
            .unitWeightKg(unitWeight)
            .demandPerDelivery(demandPerDelivery)
            .pallets(pallets)
            .shipmentWeightKg(shipmentWeight)
            .loadingMeters(loadingMeters);

        // Step 3: lane
        Optional<TransportLane> laneMatch = referenceLookup.lane(
            supplier.getCountry(), supplier.getZipCode(), destination.getCountry(), destination.getZipCode());
        if (laneMatch.isEmpty()) {
            diagnostics.record(DiagnosticType.LOOKUP_MISS, COMPONENT, String.format("No transport lane %s %s -> %s %s",
                supplier.getCountry(), supplier.getZipCode(), destination.getCountry(), destination.getZipCode()));
            steps.add("Step 5.3: No transport lane found, transport per piece = 0");
            return result.build();
        }
        TransportLane lane = laneMatch.get();
        boolean international = supplier.getCountry() == null
            || !supplier.getCountry().equalsIgnoreCase(destination.getCountry());
        steps.add(String.format("Step 5.3: Lane %s (%s), %s",
            lane.getLaneId(), lane.routeKey(), international ? "international" : "domestic"));

        // Step 4: pricing
        BigDecimal basePrice;
        String pricingRule;
        BigDecimal palletsPerTruck = BigDecimal.valueOf(properties.getPalletsPerTruck());
        if (pallets.compareTo(palletsPerTruck) > 0) {
            if (lane.getFullTruckPrice() != null && lane.getFullTruckPrice().signum() > 0) {
                BigDecimal trucks = pallets.divide(palletsPerTruck, 0, RoundingMode.FLOOR);
                BigDecimal excessPallets = pallets.subtract(trucks.multiply(palletsPerTruck));
                BigDecimal excessPrice = excessPallets.signum() > 0
                    ? weightPrice(lane, excessPallets.multiply(weightPerPallet), diagnostics)
                    : BigDecimal.ZERO;
                basePrice = trucks.multiply(lane.getFullTruckPrice()).add(excessPrice);
                pricingRule = String.format("%s full trucks + %s pallets by weight", trucks, excessPallets);
            } else {
                basePrice = weightPrice(lane, shipmentWeight, diagnostics);
                pricingRule = "weight based, no full truck price agreed";
            }
        } else {
            BigDecimal byWeight = weightPrice(lane, shipmentWeight, diagnostics);
            BigDecimal bySpace = loadingMeters.multiply(international
                ? properties.getSpaceRateInternational()
                : properties.getSpaceRateDomestic());
            basePrice = byWeight.max(bySpace);
            pricingRule = byWeight.compareTo(bySpace) >= 0 ? "weight based" : "space based";
        }
        BigDecimal surcharge = basePrice.multiply(divide(nz(lane.getFuelSurchargePercent()), BigDecimal.valueOf(100)));
        BigDecimal totalPrice = basePrice.add(surcharge);
        steps.add(String.format("Step 5.4: Base price = %.2f (%s), fuel surcharge = %.2f, total = %.2f",
            basePrice.doubleValue(), pricingRule, surcharge.doubleValue(), totalPrice.doubleValue()));

        // Step 5: per piece
        BigDecimal costPerPiece = divideOrZero(totalPrice, demandPerDelivery);
        BigDecimal bondedShare = BigDecimal.ZERO;
        if (transport.isBondedWarehouse() && transport.getMode() == TransportMode.SEA && isBondedIncoterm(operations)) {
            bondedShare = divideOrZero(nz(transport.getCostBondedPerLu()).multiply(pallets), demandPerDelivery);
            costPerPiece = costPerPiece.add(bondedShare);
        }
        steps.add(String.format("Step 5.5: Transport per piece = %.2f / %.2f%s = %s",
            totalPrice.doubleValue(), demandPerDelivery.doubleValue(),
            bondedShare.signum() > 0 ? String.format(" + bonded %s", bondedShare.toPlainString()) : "",
            costPerPiece.toPlainString()));

        return result
            .laneId(lane.getLaneId())
            .international(international)
            .basePrice(basePrice)
            .fuelSurcharge(surcharge)
            .totalPrice(totalPrice)
            .costPerLogisticsUnit(divideOrZero(totalPrice, pallets))
            .costPerPiece(max0(costPerPiece))
            .build();
    }

    private BigDecimal weightPrice(TransportLane lane, BigDecimal weightKg, CalculationDiagnostics diagnostics) {
        Optional<TransportLane.WeightBracket> bracket = lane.bracketFor(weightKg);
        if (bracket.isEmpty()) {
            diagnostics.record(DiagnosticType.LOOKUP_MISS, COMPONENT,
                "Lane " + lane.getLaneId() + " has no weight brackets");
            return BigDecimal.ZERO;
        }
        return nz(bracket.get().getPrice());
    }

    private boolean isBondedIncoterm(OperationsConfig operations) {
        Incoterm incoterm = incoterm(operations);
        return incoterm != null && properties.getBondedIncoterms().contains(incoterm);
    }

    private static Incoterm incoterm(OperationsConfig operations) {
        return operations != null ? operations.getIncoterm() : null;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TransportCost {
        private boolean automatic;
        private String laneId;
        private boolean international;
        @Builder.Default private BigDecimal unitWeightKg = BigDecimal.ZERO;
        @Builder.Default private BigDecimal demandPerDelivery = BigDecimal.ZERO;
        @Builder.Default private BigDecimal pallets = BigDecimal.ZERO;
        @Builder.Default private BigDecimal shipmentWeightKg = BigDecimal.ZERO;
        @Builder.Default private BigDecimal loadingMeters = BigDecimal.ZERO;
        @Builder.Default private BigDecimal basePrice = BigDecimal.ZERO;
        @Builder.Default private BigDecimal fuelSurcharge = BigDecimal.ZERO;
        @Builder.Default private BigDecimal totalPrice = BigDecimal.ZERO;
        @Builder.Default private BigDecimal costPerLogisticsUnit = BigDecimal.ZERO;
        @Builder.Default private BigDecimal costPerPiece = BigDecimal.ZERO;

        public static TransportCost empty() {
            return TransportCost.builder().build();
        }
    }
}
