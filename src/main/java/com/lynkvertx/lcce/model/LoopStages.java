package com.lynkvertx.lcce.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.PositiveOrZero;

/**
 * Durations (days) of each stage of the returnable packaging loop.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoopStages {

    @PositiveOrZero
    private int goodsReceipt;

    @PositiveOrZero
    private int stockRawMaterials;

    @PositiveOrZero
    private int production;

    @PositiveOrZero
    private int emptiesReturn;

    @PositiveOrZero
    private int cleaning;

    @PositiveOrZero
    private int dispatch;

    /** Empties in transit from the plant back to the supplier */
    @PositiveOrZero
    private int emptiesTransitToSupplier;

    @PositiveOrZero
    private int emptiesReceiptAtSupplier;

    @PositiveOrZero
    private int emptiesStockAtSupplier;

    /** Supplier production (contrary loop) */
    @PositiveOrZero
    private int supplierProduction;

    @PositiveOrZero
    private int stockFinishedParts;

    @PositiveOrZero
    private int dispatchFinishedParts;

    /** Full boxes in transit from the supplier to the plant */
    @PositiveOrZero
    private int transitToPlant;

    public int totalDays() {
        return goodsReceipt + stockRawMaterials + production + emptiesReturn + cleaning + dispatch
            + emptiesTransitToSupplier + emptiesReceiptAtSupplier + emptiesStockAtSupplier
            + supplierProduction + stockFinishedParts + dispatchFinishedParts + transitToPlant;
    }
}
