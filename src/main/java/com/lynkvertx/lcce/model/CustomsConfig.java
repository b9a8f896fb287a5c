package com.lynkvertx.lcce.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomsConfig {

    private String hsCode;

    /** Customs preference is used; no duty or tariff is paid */
    private boolean preferenceUsage;

    @DecimalMin(value = "0", message = "Duty rate must be between 0 and 100")
    @DecimalMax(value = "100", message = "Duty rate must be between 0 and 100")
    private BigDecimal dutyRatePercent;

    @DecimalMin(value = "0", message = "Tariff rate must be between 0 and 100")
    @DecimalMax(value = "100", message = "Tariff rate must be between 0 and 100")
    private BigDecimal tariffRatePercent;
}
