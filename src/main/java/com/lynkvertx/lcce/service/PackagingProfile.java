package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.model.SpecialPackagingVariant;
import com.lynkvertx.lcce.reference.PackagingItem;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Resolved packaging of one pair: catalog entries plus the fill quantities
 * that the transport, CO2 and warehouse engines divide by.
 * Catalog misses are represented by {@link PackagingItem#EMPTY}.
 */
@Value
@Builder
public class PackagingProfile {

    PackagingItem box;
    PackagingItem pallet;
    PackagingItem tray;
    PackagingItem specialPallet;
    PackagingItem cover;

    /** Special packaging flag as configured */
    boolean specialPackaging;

    SpecialPackagingVariant variant;

    /** Pieces per box, floored at 1 */
    BigDecimal fillQtyBox;

    /** Boxes per LU from the box catalog, floored at 1 */
    BigDecimal boxesPerLu;

    /** Pieces per standard LU, floored at 1 */
    BigDecimal fillQtyPerLu;

    /** Pieces per LU for overseas shipping as configured, may be zero */
    BigDecimal overseaFillQty;

    /** Pieces per LU of the special packaging variant, zero without special packaging */
    BigDecimal spFillQtyPerLu;

    /** Special fill when special packaging is used and positive, standard fill otherwise */
    BigDecimal effectiveFillQtyPerLu;

    /** Sum of the loop stage durations */
    BigDecimal loopDays;

    /** Loop days plus the sub-supplier box days */
    BigDecimal cocLoopDays;

    /**
     * Neutral profile used when packaging could not be resolved: empty catalog items, unit fill quantities.
     */
    public static PackagingProfile empty() {
        return PackagingProfile.builder()
            .box(PackagingItem.EMPTY)
            .pallet(PackagingItem.EMPTY)
            .tray(PackagingItem.EMPTY)
            .specialPallet(PackagingItem.EMPTY)
            .cover(PackagingItem.EMPTY)
            .variant(SpecialPackagingVariant.NONE)
            .fillQtyBox(BigDecimal.ONE)
            .boxesPerLu(BigDecimal.ONE)
            .fillQtyPerLu(BigDecimal.ONE)
            .overseaFillQty(BigDecimal.ZERO)
            .spFillQtyPerLu(BigDecimal.ZERO)
            .effectiveFillQtyPerLu(BigDecimal.ONE)
            .loopDays(BigDecimal.ZERO)
            .cocLoopDays(BigDecimal.ZERO)
            .build();
    }
}
