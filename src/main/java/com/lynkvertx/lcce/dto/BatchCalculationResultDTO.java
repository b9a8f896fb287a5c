package com.lynkvertx.lcce.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of a batch run over many material-supplier pairs
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchCalculationResultDTO {

    private int pairCount;

    private int calculatedCount;

    /** Results in request order; skipped pairs are left out */
    private List<CostCalculationResultDTO> results;

    /** Labels of pairs skipped because of missing configuration */
    private List<String> skippedPairs;

    /** Diagnostics of all pairs, prefixed with the pair label */
    private List<String> diagnostics;

    /** Sum of the annual cost of all calculated pairs */
    private BigDecimal totalAnnualCost;
}
