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
public class WarehouseConfig {

    /** Monthly cost of one storage location */
    @PositiveOrZero(message = "Cost per location must be >= 0")
    private BigDecimal costPerLocation;
}
