package com.lynkvertx.lcce.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import java.math.BigDecimal;

/**
 * Flat one-off cost amortized over the lifetime volume.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdditionalCost {

    @NotBlank(message = "Cost name is required")
    private String name;

    private BigDecimal value;
}
