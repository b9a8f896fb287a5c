package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.config.CalculationProperties;
import com.lynkvertx.lcce.dto.BatchCalculationResultDTO;
import com.lynkvertx.lcce.dto.CalculationDiagnostic;
import com.lynkvertx.lcce.dto.CostCalculationRequestDTO;
import com.lynkvertx.lcce.dto.CostCalculationResultDTO;
import com.lynkvertx.lcce.dto.DiagnosticType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Batch driver: calculates many already assembled material-supplier pairs.
 * Pairs are independent and may run in parallel; each pair owns its diagnostics collector.
 * Pairs missing a required configuration record are skipped, never failing the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchCalculationService {

    private static final String COMPONENT = "Batch";

    private static final String UNKNOWN_PAIR = "?/?";

    private final LogisticsCostCalculationService calculationService;
    private final CalculationProperties properties;

    public BatchCalculationResultDTO calculateAll(List<CostCalculationRequestDTO> pairs) {
        long start = System.currentTimeMillis();

        Stream<CostCalculationRequestDTO> stream = properties.isParallelBatch()
            ? pairs.parallelStream()
            : pairs.stream();
        // ordered collect keeps request order also for parallel streams
        List<PairOutcome> outcomes = stream
            .map(this::calculatePair)
            .collect(Collectors.toList());

        List<CostCalculationResultDTO> results = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();
        BigDecimal totalAnnualCost = BigDecimal.ZERO;
        for (PairOutcome outcome : outcomes) {
            for (CalculationDiagnostic diagnostic : outcome.diagnostics) {
                diagnostics.add(outcome.label + " " + diagnostic);
            }
            if (outcome.result == null) {
                skipped.add(outcome.label);
                continue;
            }
            results.add(outcome.result);
            totalAnnualCost = totalAnnualCost.add(outcome.result.getTotalAnnualCost());
        }

        log.info("Batch finished: {} pairs, {} calculated, {} skipped, {} diagnostics in {}ms",
            pairs.size(), results.size(), skipped.size(), diagnostics.size(), System.currentTimeMillis() - start);

        return BatchCalculationResultDTO.builder()
            .pairCount(pairs.size())
            .calculatedCount(results.size())
            .results(results)
            .skippedPairs(skipped)
            .diagnostics(diagnostics)
            .totalAnnualCost(totalAnnualCost)
            .build();
    }

    private PairOutcome calculatePair(CostCalculationRequestDTO pair) {
        if (pair == null) {
            CalculationDiagnostics diagnostics = new CalculationDiagnostics(UNKNOWN_PAIR);
            diagnostics.record(DiagnosticType.CONFIG_MISSING, COMPONENT, "Skipped, empty pair entry");
            return new PairOutcome(UNKNOWN_PAIR, null, diagnostics.getEntries());
        }
        String label = pair.pairLabel();
        CalculationDiagnostics diagnostics = new CalculationDiagnostics(label);

        List<String> missing = calculationService.missingConfigs(pair);
        if (!missing.isEmpty()) {
            diagnostics.record(DiagnosticType.CONFIG_MISSING, COMPONENT,
                "Skipped, missing " + String.join(", ", missing));
            return new PairOutcome(label, null, diagnostics.getEntries());
        }

        try {
            CostCalculationResultDTO result = calculationService.calculate(pair, diagnostics);
            return new PairOutcome(label, result, diagnostics.getEntries());
        } catch (RuntimeException e) {
            log.error("Calculation of {} failed", label, e);
            diagnostics.record(DiagnosticType.COMPUTATION_EXCEPTION, COMPONENT, "Skipped, " + e.getMessage());
            return new PairOutcome(label, null, diagnostics.getEntries());
        }
    }

    private static class PairOutcome {
        private final String label;
        private final CostCalculationResultDTO result;
        private final List<CalculationDiagnostic> diagnostics;

        PairOutcome(String label, CostCalculationResultDTO result, List<CalculationDiagnostic> diagnostics) {
            this.label = label;
            this.result = result;
            this.diagnostics = diagnostics;
        }
    }
}
