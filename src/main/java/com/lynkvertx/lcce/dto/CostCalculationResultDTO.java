package com.lynkvertx.lcce.dto;

import com.lynkvertx.lcce.model.TransportMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Itemized logistics cost of one material-supplier pair.
 * Carries every intermediate figure needed for reports and result tables.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostCalculationResultDTO {

    // Identification
    private String materialNo;
    private String materialDescription;
    private String vendorId;
    private String supplierName;
    private String supplierCountry;
    private String destinationPlant;

    /** Annual volume (pcs) */
    private BigDecimal annualVolume;

    /** Annual volume × lifetime years (pcs) */
    private BigDecimal lifetimeVolume;

    // Packaging
    private BigDecimal packagingLoopDays;
    private BigDecimal cocLoopDays;
    private BigDecimal fillQtyPerLu;
    private BigDecimal spFillQtyPerLu;
    private BigDecimal plantBoxes;
    private BigDecimal plantLogisticsUnits;
    private BigDecimal packagingCostPlant;
    private BigDecimal cocBoxes;
    private BigDecimal cocLogisticsUnits;
    private BigDecimal cocTrays;
    private BigDecimal cocPalletCovers;
    private BigDecimal packagingCostCoc;
    private BigDecimal packagingCostTotal;
    private BigDecimal scrapWood;
    private BigDecimal packagingCostPerPiece;

    /** Minimum order quantity (pcs) */
    private BigDecimal minimumOrderQuantity;

    // Repacking
    private String weightCategory;
    private String repackingOperation;
    private BigDecimal repackingCostPerPiece;

    // Transport
    private TransportMode transportMode;
    private boolean automaticTransport;
    private String transportLaneId;
    private BigDecimal palletsPerDelivery;
    private BigDecimal shipmentWeightKg;
    private BigDecimal loadingMeters;

    /** Price of one delivery including fuel surcharge (automatic mode only) */
    private BigDecimal transportPricePerDelivery;
    private BigDecimal transportCostPerLogisticsUnit;
    private BigDecimal transportCostPerPiece;

    // Customs
    private BigDecimal dutyRatePercent;
    private BigDecimal tariffRatePercent;
    private BigDecimal dutyPerPiece;
    private BigDecimal tariffPerPiece;
    private BigDecimal customsCostPerPiece;

    // CO2
    private BigDecimal co2TotalTons;
    private BigDecimal co2EmissionKg;
    private BigDecimal co2CostPerPiece;

    // Warehouse
    private BigDecimal inventoryDays;
    private BigDecimal safetyStockDays;
    private BigDecimal storageLocationsLocal;
    private BigDecimal storageLocationsTotal;
    private BigDecimal warehouseCostPerPiece;

    private BigDecimal additionalCostPerPiece;

    // Totals
    private BigDecimal totalCostPerPiece;
    private BigDecimal totalAnnualCost;

    /** Non-fatal problems; a zeroed component is always explained here */
    private List<CalculationDiagnostic> diagnostics;

    /** Step-by-step calculation debug info */
    private List<String> calculationSteps;

    /** ISO 8601 timestamp */
    private String calculatedAt;
}
