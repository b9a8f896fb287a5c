package com.lynkvertx.lcce.controller;

import com.lynkvertx.lcce.dto.ApiResponse;
import com.lynkvertx.lcce.dto.BatchCalculationRequestDTO;
import com.lynkvertx.lcce.dto.BatchCalculationResultDTO;
import com.lynkvertx.lcce.dto.CostCalculationRequestDTO;
import com.lynkvertx.lcce.dto.CostCalculationResultDTO;
import com.lynkvertx.lcce.service.BatchCalculationService;
import com.lynkvertx.lcce.service.LogisticsCostCalculationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;

/**
 * Logistics Cost Calculation REST Controller
 */
@RestController
@RequestMapping("/api/calculations")
@RequiredArgsConstructor
@Tag(name = "Cost Calculation", description = "Logistics cost per piece calculation APIs")
public class CostCalculationController {

    private final LogisticsCostCalculationService calculationService;
    private final BatchCalculationService batchService;

    @PostMapping
    @Operation(summary = "Calculate pair", description = "Calculate the itemized logistics cost of one material-supplier pair")
    public ResponseEntity<ApiResponse<CostCalculationResultDTO>> calculate(
            @Valid @RequestBody CostCalculationRequestDTO request) {
        CostCalculationResultDTO result = calculationService.calculate(request);
        return ResponseEntity.ok(ApiResponse.success("Cost calculation completed", result));
    }

    @PostMapping("/batch")
    @Operation(summary = "Calculate batch", description = "Calculate many pairs; pairs with missing configuration are skipped")
    public ResponseEntity<ApiResponse<BatchCalculationResultDTO>> calculateBatch(
            @Valid @RequestBody BatchCalculationRequestDTO request) {
        BatchCalculationResultDTO result = batchService.calculateAll(request.getPairs());
        return ResponseEntity.ok(ApiResponse.success(
            String.format("Batch calculation completed: %d of %d pairs calculated",
                result.getCalculatedCount(), result.getPairCount()),
            result));
    }
}
