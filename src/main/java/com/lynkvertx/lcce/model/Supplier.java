package com.lynkvertx.lcce.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Supplier {

    @NotBlank(message = "Vendor id is required")
    private String vendorId;

    private String name;

    /** ISO country code of the shipping location */
    private String country;

    /** Zip code of the shipping location; only the prefix is used for lane matching */
    private String zipCode;

    @PositiveOrZero(message = "Deliveries per month must be >= 0")
    private Integer deliveriesPerMonth;

    /** Distance to the receiving plant (km) */
    @PositiveOrZero(message = "Distance must be >= 0")
    private BigDecimal distanceKm;
}
