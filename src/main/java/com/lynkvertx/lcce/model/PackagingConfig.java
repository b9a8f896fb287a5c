package com.lynkvertx.lcce.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.Valid;
import javax.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;

/**
 * Packaging set-up of a material-supplier pair.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PackagingConfig {

    // Standard packaging (plant)
    private BoxType boxType;

    @PositiveOrZero(message = "Filling quantity per box must be >= 0")
    private Integer fillQtyBox;

    private PalletType palletType;

    /** Pieces per LU for overseas shipping */
    @PositiveOrZero(message = "Overseas filling quantity must be >= 0")
    private Integer fillQtyLuOversea;

    /** Price of additional packaging per box (inlays etc.) */
    @PositiveOrZero
    private BigDecimal additionalPackagingPrice;

    /** Empties scrapping allowance for cardboard */
    @PositiveOrZero
    private BigDecimal emptiesScrapCardboard;

    // Special packaging (CoC)
    private boolean specialPackagingNeeded;

    @Builder.Default
    private SpecialPackagingVariant specialPackagingVariant = SpecialPackagingVariant.NONE;

    @PositiveOrZero
    private Integer fillQtyTray;

    /** Special pallet and cover needed in addition to the trays */
    private boolean additionalSpecialPackagingNeeded;

    @PositiveOrZero
    private Integer traysPerSpecialPallet;

    @PositiveOrZero
    private Integer specialPalletsPerLu;

    /** One-time tooling cost of the special packaging */
    @PositiveOrZero
    private BigDecimal toolingCost;

    @Valid
    private LoopStages loopStages;

    public SpecialPackagingVariant effectiveVariant() {
        if (!specialPackagingNeeded || specialPackagingVariant == null) {
            return SpecialPackagingVariant.NONE;
        }
        return specialPackagingVariant;
    }
}
