package com.lynkvertx.lcce.reference;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.lynkvertx.lcce.model.PackagingMaterial;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Catalog entry for a box, pallet, tray or pallet accessory. Immutable, shared by concurrent calculations.
 */
@Value
@Builder
@Jacksonized
@AllArgsConstructor
public class PackagingItem {

    /** Returned for catalog misses so that callers can keep calculating with zeros */
    public static final PackagingItem EMPTY = new PackagingItem("n/a", null,
        BigDecimal.ZERO, BigDecimal.ZERO, 0, 0);

    private String description;

    private PackagingMaterial material;

    private BigDecimal unitWeightKg;

    private BigDecimal unitPrice;

    /** Units of this item per logistics unit (e.g. boxes per pallet) */
    private Integer unitsPerLogisticsUnit;

    private Integer unitsPerLayer;

    @JsonIgnore
    public boolean isWood() {
        return material == PackagingMaterial.WOOD;
    }
}
