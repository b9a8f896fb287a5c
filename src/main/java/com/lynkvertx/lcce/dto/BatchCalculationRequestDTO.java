package com.lynkvertx.lcce.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchCalculationRequestDTO {

    @Valid
    @NotEmpty(message = "At least one material-supplier pair is required")
    private List<CostCalculationRequestDTO> pairs;
}
