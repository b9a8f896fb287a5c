package com.lynkvertx.lcce.service;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class CostMathTest {

    @Test
    void ceilToMultiple_roundsUpToNextMultiple() {
        assertThat(CostMath.ceilToMultiple(new BigDecimal("134.4"), BigDecimal.TEN)).isEqualByComparingTo("140");
        assertThat(CostMath.ceilToMultiple(new BigDecimal("140"), BigDecimal.TEN)).isEqualByComparingTo("140");
        assertThat(CostMath.ceilToMultiple(new BigDecimal("0.1"), BigDecimal.TEN)).isEqualByComparingTo("10");
    }

    @Test
    void ceilToMultiple_withoutMultiple_isPlainCeiling() {
        assertThat(CostMath.ceilToMultiple(new BigDecimal("2.1"), BigDecimal.ZERO)).isEqualByComparingTo("3");
        assertThat(CostMath.ceilToMultiple(new BigDecimal("2.1"), null)).isEqualByComparingTo("3");
    }

    @Test
    void divideOrZero_nonPositiveDivisor_returnsZero() {
        assertThat(CostMath.divideOrZero(BigDecimal.TEN, BigDecimal.ZERO)).isEqualByComparingTo("0");
        assertThat(CostMath.divideOrZero(BigDecimal.TEN, new BigDecimal("-2"))).isEqualByComparingTo("0");
        assertThat(CostMath.divideOrZero(BigDecimal.TEN, null)).isEqualByComparingTo("0");
        assertThat(CostMath.divideOrZero(BigDecimal.TEN, new BigDecimal("4"))).isEqualByComparingTo("2.5");
    }

    @Test
    void perPiece_roundsUpToScaleAndNeverNegative() {
        assertThat(CostMath.perPiece(new BigDecimal("0.00056583"), 3)).isEqualByComparingTo("0.001");
        assertThat(CostMath.perPiece(new BigDecimal("0.024"), 3)).isEqualByComparingTo("0.024");
        assertThat(CostMath.perPiece(new BigDecimal("-0.5"), 3)).isEqualByComparingTo("0");
    }

    @Test
    void nz_mapsNullToZero() {
        assertThat(CostMath.nz((BigDecimal) null)).isEqualByComparingTo("0");
        assertThat(CostMath.nz((Integer) null)).isEqualByComparingTo("0");
        assertThat(CostMath.nz((Long) null)).isEqualByComparingTo("0");
        assertThat(CostMath.nz(7)).isEqualByComparingTo("7");
    }
}
