package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.model.Material;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

import static com.lynkvertx.lcce.service.CostMath.nz;

/**
 * Lifetime piece volume used to amortize one-off costs.
 */
@Component
public class VolumeCalculator {

    /**
     * Annual volume × lifetime years. Callers must treat a result of zero or less
     * as "no volume" and return zero per-piece costs.
     */
    public BigDecimal lifetimeVolume(Material material) {
        if (material == null) {
            return BigDecimal.ZERO;
        }
        return nz(material.getAnnualVolume()).multiply(nz(material.getLifetimeYears()));
    }

    public BigDecimal annualVolume(Material material) {
        return material != null ? nz(material.getAnnualVolume()) : BigDecimal.ZERO;
    }
}
