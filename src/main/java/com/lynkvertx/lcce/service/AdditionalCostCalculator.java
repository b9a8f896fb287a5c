package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.model.AdditionalCost;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

import static com.lynkvertx.lcce.service.CostMath.divideOrZero;
import static com.lynkvertx.lcce.service.CostMath.nz;

/**
 * Flat extra costs amortized over the lifetime volume.
 */
@Service
public class AdditionalCostCalculator {

    static final String COMPONENT = "Additional";

    public BigDecimal costPerPiece(List<AdditionalCost> additionalCosts, BigDecimal lifetimeVolume, List<String> steps) {
        BigDecimal total = BigDecimal.ZERO;
        if (additionalCosts != null) {
            for (AdditionalCost cost : additionalCosts) {
                if (cost != null) {
                    total = total.add(nz(cost.getValue()));
                }
            }
        }
        BigDecimal perPiece = divideOrZero(total, lifetimeVolume);
        steps.add(String.format("Step 9: Additional costs %.2f / %s = %s per piece",
            total.doubleValue(), lifetimeVolume.toPlainString(), perPiece.toPlainString()));
        return perPiece;
    }
}
