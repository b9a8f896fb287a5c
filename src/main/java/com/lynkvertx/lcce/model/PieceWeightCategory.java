package com.lynkvertx.lcce.model;

import java.math.BigDecimal;

/**
 * Piece weight categories of the repacking operation price table.
 */
public enum PieceWeightCategory {
    NONE("None"),
    LIGHT("light (up to 0,050kg)"),
    MODERATE("moderate (up to 0,150kg)"),
    HEAVY("heavy (from 0,150kg)");

    private static final BigDecimal LIGHT_LIMIT_KG = new BigDecimal("0.050");
    private static final BigDecimal MODERATE_LIMIT_KG = new BigDecimal("0.150");

    private final String label;

    PieceWeightCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Derive the category from the weight of a single piece.
     * A missing or zero weight maps to {@link #NONE}.
     */
    public static PieceWeightCategory of(BigDecimal weightPerPieceKg) {
        if (weightPerPieceKg == null || weightPerPieceKg.signum() <= 0) {
            return NONE;
        }
        if (weightPerPieceKg.compareTo(LIGHT_LIMIT_KG) <= 0) {
            return LIGHT;
        }
        if (weightPerPieceKg.compareTo(MODERATE_LIMIT_KG) <= 0) {
            return MODERATE;
        }
        return HEAVY;
    }
}
