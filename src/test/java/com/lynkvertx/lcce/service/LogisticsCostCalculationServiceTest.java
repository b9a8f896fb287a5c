package com.lynkvertx.lcce.service;

import com.lynkvertx.lcce.dto.CalculationDiagnostic;
import com.lynkvertx.lcce.dto.CostCalculationRequestDTO;
import com.lynkvertx.lcce.dto.CostCalculationResultDTO;
import com.lynkvertx.lcce.dto.DiagnosticType;
import com.lynkvertx.lcce.model.AdditionalCost;
import com.lynkvertx.lcce.model.CustomsConfig;
import com.lynkvertx.lcce.model.Incoterm;
import com.lynkvertx.lcce.model.OperationsConfig;
import com.lynkvertx.lcce.model.PieceWeightCategory;
import com.lynkvertx.lcce.model.RepackingConfig;
import com.lynkvertx.lcce.model.ReturnablePackaging;
import com.lynkvertx.lcce.model.SupplierPackaging;
import com.lynkvertx.lcce.model.TransportConfig;
import com.lynkvertx.lcce.model.TransportMode;
import com.lynkvertx.lcce.reference.ReferenceLookupService;
import com.lynkvertx.lcce.config.CalculationProperties;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LogisticsCostCalculationServiceTest {

    private final LogisticsCostCalculationService service = CalculationFixtures.calculationService();

    @Test
    void zeroDutyRate_noCustomsCost_positivePackagingCost() {
        CostCalculationRequestDTO request = CalculationFixtures.request();
        request.setCustoms(CustomsConfig.builder().dutyRatePercent(BigDecimal.ZERO).build());

        CostCalculationResultDTO result = service.calculate(request);

        assertThat(result.getCustomsCostPerPiece()).isEqualByComparingTo("0");
        assertThat(result.getPackagingCostPerPiece()).isPositive();
        assertThat(result.getTransportCostPerPiece()).isEqualByComparingTo("0.1");
        assertThat(result.getWarehouseCostPerPiece()).isEqualByComparingTo("0.024");
        assertThat(result.getCo2CostPerPiece()).isEqualByComparingTo("0.002");
        assertThat(result.getTotalCostPerPiece()).isEqualByComparingTo("0.127");
        assertThat(result.getTotalAnnualCost()).isEqualByComparingTo("15240");
    }

    @Test
    void dutyRate_appliesToPiecePricePlusTransport() {
        CostCalculationRequestDTO request = CalculationFixtures.request();
        request.setCustoms(CustomsConfig.builder().dutyRatePercent(new BigDecimal("5")).build());

        CostCalculationResultDTO result = service.calculate(request);

        BigDecimal expected = new BigDecimal("0.05").multiply(new BigDecimal("2.00").add(result.getTransportCostPerPiece()));
        assertThat(result.getCustomsCostPerPiece()).isEqualByComparingTo(expected);
        assertThat(result.getCustomsCostPerPiece()).isEqualByComparingTo("0.105");
    }

    @Test
    void seaFreightFob_addsBondedLeg() {
        CostCalculationRequestDTO request = CalculationFixtures.request();
        request.setTransport(TransportConfig.builder()
            .mode(TransportMode.SEA)
            .costPerLu(new BigDecimal("500"))
            .costBondedPerLu(new BigDecimal("80"))
            .build());
        request.setOperations(OperationsConfig.builder().incoterm(Incoterm.FOB).leadTimeDays(10).build());

        CostCalculationResultDTO result = service.calculate(request);

        assertThat(result.getTransportCostPerPiece()).isEqualByComparingTo("0.58");
        assertThat(result.getTransportMode()).isEqualTo(TransportMode.SEA);
    }

    @Test
    void missingRepackingRate_isDiagnosedNotRaised() {
        CostCalculationRequestDTO request = CalculationFixtures.request();
        request.setRepacking(RepackingConfig.builder()
            .weightCategory(PieceWeightCategory.HEAVY)
            .supplierPackaging(SupplierPackaging.ONE_WAY_TRAY_IN_BOX)
            .returnablePackaging(ReturnablePackaging.RETURNABLE_TRAYS)
            .build());

        CostCalculationResultDTO result = service.calculate(request);

        assertThat(result.getRepackingCostPerPiece()).isEqualByComparingTo("0");
        assertThat(result.getDiagnostics()).extracting(CalculationDiagnostic::getType)
            .contains(DiagnosticType.LOOKUP_MISS);
    }

    @Test
    void total_isSumOfComponents_annualIsTotalTimesVolume() {
        CostCalculationRequestDTO request = CalculationFixtures.request();
        request.setCustoms(CustomsConfig.builder().dutyRatePercent(new BigDecimal("3")).build());
        request.setRepacking(RepackingConfig.builder()
            .weightCategory(PieceWeightCategory.LIGHT)
            .supplierPackaging(SupplierPackaging.ONE_WAY_TRAY_IN_BOX)
            .returnablePackaging(ReturnablePackaging.RETURNABLE_TRAYS)
            .build());
        request.setAdditionalCosts(List.of(new AdditionalCost("Audit", new BigDecimal("1200"))));

        CostCalculationResultDTO result = service.calculate(request);

        BigDecimal sum = result.getPackagingCostPerPiece()
            .add(result.getRepackingCostPerPiece())
            .add(result.getCustomsCostPerPiece())
            .add(result.getTransportCostPerPiece())
            .add(result.getWarehouseCostPerPiece())
            .add(result.getAdditionalCostPerPiece())
            .add(result.getCo2CostPerPiece());
        assertThat(result.getRepackingCostPerPiece()).isEqualByComparingTo("0.10");
        assertThat(result.getAdditionalCostPerPiece()).isEqualByComparingTo("0.002");
        assertThat(result.getTotalCostPerPiece()).isEqualByComparingTo(sum);
        assertThat(result.getTotalAnnualCost()).isEqualByComparingTo(sum.multiply(BigDecimal.valueOf(120_000)));
        assertThat(result.getCalculationSteps()).isNotEmpty();
    }

    @Test
    void noLocation_usesDefaultPlant() {
        CostCalculationResultDTO result = service.calculate(CalculationFixtures.request());

        assertThat(result.getDestinationPlant()).isEqualTo("Munich");
    }

    @Test
    void missingTransportConfig_isRejected() {
        CostCalculationRequestDTO request = CalculationFixtures.request();
        request.setTransport(null);

        assertThat(service.missingConfigs(request)).containsExactly("TransportConfig");
        assertThatThrownBy(() -> service.calculate(request))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("M-100/V-200")
            .hasMessageContaining("TransportConfig");
    }

    @Test
    void failingComponent_contributesZeroAndIsDiagnosed() {
        ReferenceLookupService lookup = CalculationFixtures.lookup();
        CalculationProperties properties = CalculationFixtures.properties();
        CustomsCostCalculator customs = mock(CustomsCostCalculator.class);
        when(customs.calculate(any(), any(), any(), any())).thenThrow(new IllegalStateException("rate table broken"));
        LogisticsCostCalculationService guarded = new LogisticsCostCalculationService(
            new VolumeCalculator(),
            new PackagingCostCalculator(lookup, properties),
            new RepackingCostCalculator(lookup),
            new TransportCostCalculator(lookup, properties),
            new Co2CostCalculator(properties),
            customs,
            new WarehouseCostCalculator(properties),
            new AdditionalCostCalculator(),
            properties);
        CostCalculationRequestDTO request = CalculationFixtures.request();
        request.setCustoms(CustomsConfig.builder().dutyRatePercent(new BigDecimal("5")).build());

        CostCalculationResultDTO result = guarded.calculate(request);

        assertThat(result.getCustomsCostPerPiece()).isEqualByComparingTo("0");
        assertThat(result.getTotalCostPerPiece()).isEqualByComparingTo("0.127");
        assertThat(result.getDiagnostics())
            .anyMatch(d -> d.getType() == DiagnosticType.COMPUTATION_EXCEPTION
                && d.getComponent().equals(CustomsCostCalculator.COMPONENT)
                && d.getMessage().contains("rate table broken"));
    }
}
