package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.config.CalculationProperties;
import com.lynkvertx.lcce.dto.BatchCalculationResultDTO;
import com.lynkvertx.lcce.dto.CostCalculationRequestDTO;
import com.lynkvertx.lcce.dto.CostCalculationResultDTO;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchCalculationServiceTest {

    @Test
    void parallelBatch_keepsRequestOrder() {
        List<CostCalculationRequestDTO> pairs = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            CostCalculationRequestDTO pair = CalculationFixtures.request();
            pair.getMaterial().setMaterialNo("M-" + i);
            pairs.add(pair);
        }

        BatchCalculationResultDTO result = service(true).calculateAll(pairs);

        assertThat(result.getCalculatedCount()).isEqualTo(20);
        assertThat(result.getResults()).extracting(CostCalculationResultDTO::getMaterialNo)
            .containsExactly(pairs.stream().map(p -> p.getMaterial().getMaterialNo()).toArray(String[]::new));
        assertThat(result.getTotalAnnualCost()).isEqualByComparingTo("304800");
    }

    @Test
    void pairMissingConfig_isSkippedWithDiagnostic() {
        CostCalculationRequestDTO complete = CalculationFixtures.request();
        CostCalculationRequestDTO incomplete = CalculationFixtures.request();
        incomplete.getMaterial().setMaterialNo("M-999");
        incomplete.setPackaging(null);

        BatchCalculationResultDTO result = service(false).calculateAll(List.of(complete, incomplete));

        assertThat(result.getPairCount()).isEqualTo(2);
        assertThat(result.getCalculatedCount()).isEqualTo(1);
        assertThat(result.getSkippedPairs()).containsExactly("M-999/V-200");
        assertThat(result.getDiagnostics())
            .anyMatch(d -> d.startsWith("M-999/V-200") && d.contains("CONFIG_MISSING") && d.contains("PackagingConfig"));
        assertThat(result.getTotalAnnualCost()).isEqualByComparingTo("15240");
    }

    @Test
    void nullPairEntry_isSkippedWithoutAbortingBatch() {
        List<CostCalculationRequestDTO> pairs = Arrays.asList(CalculationFixtures.request(), null);

        for (boolean parallel : new boolean[] {false, true}) {
            BatchCalculationResultDTO result = service(parallel).calculateAll(pairs);

            assertThat(result.getPairCount()).isEqualTo(2);
            assertThat(result.getCalculatedCount()).isEqualTo(1);
            assertThat(result.getResults()).extracting(CostCalculationResultDTO::getMaterialNo).containsExactly("M-100");
            assertThat(result.getSkippedPairs()).containsExactly("?/?");
            assertThat(result.getDiagnostics()).anyMatch(d -> d.startsWith("?/?") && d.contains("CONFIG_MISSING"));
        }
    }

    @Test
    void sequentialAndParallel_giveSameTotals() {
        List<CostCalculationRequestDTO> pairs = List.of(CalculationFixtures.request(), CalculationFixtures.request());

        BatchCalculationResultDTO sequential = service(false).calculateAll(pairs);
        BatchCalculationResultDTO parallel = service(true).calculateAll(pairs);

        assertThat(parallel.getTotalAnnualCost()).isEqualByComparingTo(sequential.getTotalAnnualCost());
    }

    private static BatchCalculationService service(boolean parallel) {
        CalculationProperties properties = CalculationFixtures.properties();
        properties.setParallelBatch(parallel);
        return new BatchCalculationService(CalculationFixtures.calculationService(), properties);
    }
}
