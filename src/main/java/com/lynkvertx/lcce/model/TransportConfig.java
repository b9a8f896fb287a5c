package com.lynkvertx.lcce.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotNull;
import javax.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransportConfig {

    @NotNull(message = "Transport mode is required")
    private TransportMode mode;

    /** Manual transport cost per LU */
    @PositiveOrZero
    private BigDecimal costPerLu;

    /** Transport cost per LU from the bonded warehouse */
    @PositiveOrZero
    private BigDecimal costBondedPerLu;

    /** Pallets stacked per floor position */
    @PositiveOrZero
    private BigDecimal stackabilityFactor;

    /** Derive the rate from the transport lane table instead of the manual cost per LU */
    private boolean automaticCalculation;

    private boolean bondedWarehouse;
}
