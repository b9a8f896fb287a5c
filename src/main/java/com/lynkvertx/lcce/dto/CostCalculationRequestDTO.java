package com.lynkvertx.lcce.dto;

import com.lynkvertx.lcce.model.AdditionalCost;
import com.lynkvertx.lcce.model.Co2Config;
import com.lynkvertx.lcce.model.CustomsConfig;
import com.lynkvertx.lcce.model.Location;
import com.lynkvertx.lcce.model.Material;
import com.lynkvertx.lcce.model.OperationsConfig;
import com.lynkvertx.lcce.model.PackagingConfig;
import com.lynkvertx.lcce.model.RepackingConfig;
import com.lynkvertx.lcce.model.Supplier;
import com.lynkvertx.lcce.model.TransportConfig;
import com.lynkvertx.lcce.model.WarehouseConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import javax.validation.Valid;
import java.util.ArrayList;
import java.util.List;

/**
 * All configuration records of one material-supplier pair.
 * Material, supplier, packaging and transport are required; the remaining records are optional
 * and contribute nothing when absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostCalculationRequestDTO {

    @Valid
    private Material material;

    @Valid
    private Supplier supplier;

    /** Receiving plant; the configured default plant is used when absent */
    @Valid
    private Location location;

    @Valid
    private PackagingConfig packaging;

    @Valid
    private TransportConfig transport;

    @Valid
    private OperationsConfig operations;

    @Valid
    private WarehouseConfig warehouse;

    @Valid
    private RepackingConfig repacking;

    @Valid
    private Co2Config co2;

    @Valid
    private CustomsConfig customs;

    @Valid
    @Builder.Default
    private List<AdditionalCost> additionalCosts = new ArrayList<>();

    /** Human readable pair key, e.g. "M-100/V-200" */
    public String pairLabel() {
        String materialNo = material != null ? material.getMaterialNo() : "?";
        String vendorId = supplier != null ? supplier.getVendorId() : "?";
        return materialNo + "/" + vendorId;
    }
}
