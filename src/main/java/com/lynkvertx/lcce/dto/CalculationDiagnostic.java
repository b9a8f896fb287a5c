package com.lynkvertx.lcce.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalculationDiagnostic {

    private DiagnosticType type;

    /** Cost component that recorded the diagnostic, e.g. "Transport" */
    private String component;

    private String message;

    @Override
    public String toString() {
        return "[" + type + "] " + component + ": " + message;
    }
}
