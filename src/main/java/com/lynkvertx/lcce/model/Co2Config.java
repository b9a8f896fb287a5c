package com.lynkvertx.lcce.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Co2Config {

    @PositiveOrZero
    private BigDecimal costPerTon;

    /** Mode / route dependent factor, e.g. 3.31 sea, 3.17 or 2.65 road / rail */
    @PositiveOrZero
    private BigDecimal conversionFactor;
}
