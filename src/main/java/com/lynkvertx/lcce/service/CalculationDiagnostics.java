package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.dto.CalculationDiagnostic;
import com.lynkvertx.lcce.dto.DiagnosticType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Diagnostics collector owned by a single calculation call.
 * Not thread-safe: every pair gets its own instance, so batch runs never share one.
 */
@Slf4j
public class CalculationDiagnostics {

    private final String subject;
    private final List<CalculationDiagnostic> entries = new ArrayList<>();

    /**
     * @param subject label of the calculated pair, used as log prefix
     */
    public CalculationDiagnostics(String subject) {
        this.subject = subject;
    }

    /**
     * Record a diagnostic. Repeated identical entries are kept once.
     */
    public void record(DiagnosticType type, String component, String message) {
        CalculationDiagnostic diagnostic = new CalculationDiagnostic(type, component, message);
        if (entries.contains(diagnostic)) {
            return;
        }
        entries.add(diagnostic);
        log.warn("{}: {}", subject, diagnostic);
    }

    /**
     * Floor a denominator at 1, recording a division guard when the value had to be replaced.
     */
    public BigDecimal atLeastOne(BigDecimal value, String component, String name) {
        if (value == null || value.compareTo(BigDecimal.ONE) < 0) {
            record(DiagnosticType.DIVISION_GUARD, component,
                String.format("%s is %s, using 1 instead", name, value));
            return BigDecimal.ONE;
        }
        return value;
    }

    public BigDecimal atLeastOne(Integer value, String component, String name) {
        return atLeastOne(value != null ? BigDecimal.valueOf(value) : null, component, name);
    }

    /**
     * Run one cost component. Any runtime failure is recorded and replaced by the fallback value,
     * so a broken component never aborts the pair.
     */
    public <T> T guard(String component, Supplier<T> computation, Supplier<T> fallback) {
        try {
            return computation.get();
        } catch (RuntimeException e) {
            log.debug("{}: {} failed", subject, component, e);
            record(DiagnosticType.COMPUTATION_EXCEPTION, component,
                e.getClass().getSimpleName() + (e.getMessage() != null ? ": " + e.getMessage() : ""));
            return fallback.get();
        }
    }

    public List<CalculationDiagnostic> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean has(DiagnosticType type) {
        return entries.stream().anyMatch(entry -> entry.getType() == type);
    }
}
