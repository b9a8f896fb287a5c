package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.dto.DiagnosticType;
import com.lynkvertx.lcce.model.Material;
import com.lynkvertx.lcce.model.PieceWeightCategory;
import com.lynkvertx.lcce.model.RepackingConfig;
import com.lynkvertx.lcce.model.RepackingUnit;
import com.lynkvertx.lcce.model.ReturnablePackaging;
import com.lynkvertx.lcce.model.SupplierPackaging;
import com.lynkvertx.lcce.reference.ReferenceLookupService;
import com.lynkvertx.lcce.reference.RepackingRate;
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

import static com.lynkvertx.lcce.service.CostMath.nz;

/**
 * Repacking Cost Lookup
 *
 * Resolves the cost of repacking one piece from the supplier's packaging into the
 * returnable packaging, keyed by piece weight category and the packaging pair.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RepackingCostCalculator {

    static final String COMPONENT = "Repacking";

    private final ReferenceLookupService referenceLookup;

    public RepackingCost calculate(Material material, RepackingConfig repacking,
                                   CalculationDiagnostics diagnostics, List<String> steps) {
        if (repacking == null) {
            steps.add("Step 4: No repacking configured, repacking per piece = 0");
            return RepackingCost.empty();
        }

        PieceWeightCategory category = repacking.getWeightCategory() != null
            ? repacking.getWeightCategory()
            : PieceWeightCategory.of(material.getWeightPerPieceKg());
        SupplierPackaging supplierPackaging = repacking.getSupplierPackaging() != null
            ? repacking.getSupplierPackaging()
            : SupplierPackaging.NOT_APPLICABLE;
        ReturnablePackaging returnablePackaging = repacking.getReturnablePackaging() != null
            ? repacking.getReturnablePackaging()
            : ReturnablePackaging.NOT_APPLICABLE;

        Optional<RepackingRate> rate = referenceLookup.repackingRate(category, supplierPackaging, returnablePackaging);
        if (rate.isEmpty()) {
            diagnostics.record(DiagnosticType.LOOKUP_MISS, COMPONENT, String.format(
                "No repacking rate for %s / %s / %s", category.getLabel(), supplierPackaging, returnablePackaging));
            steps.add("Step 4: No repacking rate found, repacking per piece = 0");
            return RepackingCost.builder().weightCategory(category).build();
        }

        RepackingRate matched = rate.get();
        BigDecimal cost = BigDecimal.ZERO;
        if (matched.getUnit() == RepackingUnit.PER_PART) {
            cost = nz(matched.getCost());
        } else {
            // per tray and per bag prices need a pieces-per-unit figure the table does not carry
            diagnostics.record(DiagnosticType.UNSUPPORTED_UNIT, COMPONENT, String.format(
                "Repacking rate unit %s is not supported, using 0", matched.getUnit()));
        }
        steps.add(String.format("Step 4: Repacking %s / %s / %s (%s) = %s per piece",
            category.getLabel(), supplierPackaging, returnablePackaging, matched.getOperationType(),
            cost.toPlainString()));

        return RepackingCost.builder()
            .weightCategory(category)
            .operationType(matched.getOperationType())
            .costPerPiece(cost)
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RepackingCost {
        private PieceWeightCategory weightCategory;
        private String operationType;
        @Builder.Default private BigDecimal costPerPiece = BigDecimal.ZERO;

        public static RepackingCost empty() {
            return RepackingCost.builder().build();
        }
    }
}
