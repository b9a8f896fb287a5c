package com.lynkvertx.lcce.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;

/**
 * Manufactured material whose logistics cost is calculated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Material {

    @NotBlank(message = "Material number is required")
    private String materialNo;

    private String description;

    /** Weight of a single piece (kg) */
    @PositiveOrZero(message = "Weight per piece must be >= 0")
    private BigDecimal weightPerPieceKg;

    /** Annual demand (pcs) */
    @PositiveOrZero(message = "Annual volume must be >= 0")
    private Long annualVolume;

    /** Daily demand (pcs) */
    @PositiveOrZero(message = "Daily demand must be >= 0")
    private BigDecimal dailyDemand;

    /** Project lifetime (years) */
    @PositiveOrZero(message = "Lifetime must be >= 0")
    private BigDecimal lifetimeYears;

    /** Purchase price of one piece */
    @PositiveOrZero(message = "Piece price must be >= 0")
    private BigDecimal piecePrice;
}
