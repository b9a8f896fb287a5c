package com.lynkvertx.lcce.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.constraints.PositiveOrZero;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationsConfig {

    private Incoterm incoterm;

    private String incotermPlace;

    /** Replenishment lead time (days) */
    @PositiveOrZero
    private Integer leadTimeDays;

    private boolean subSupplierUsed;

    /** Days the sub-supplier holds boxes */
    @PositiveOrZero
    private Integer subSupplierBoxDays;

    public int effectiveSubSupplierBoxDays() {
        return subSupplierUsed && subSupplierBoxDays != null ? subSupplierBoxDays : 0;
    }
}
