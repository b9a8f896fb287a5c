package com.lynkvertx.lcce.reference;

import com.lynkvertx.lcce.model.PieceWeightCategory;
import com.lynkvertx.lcce.model.RepackingUnit;
import com.lynkvertx.lcce.model.ReturnablePackaging;
import com.lynkvertx.lcce.model.SupplierPackaging;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Price of one repacking operation from supplier packaging into returnable packaging.
 */
@Value
@Builder
@Jacksonized
@AllArgsConstructor
public class RepackingRate {

    private PieceWeightCategory weightCategory;

    private SupplierPackaging supplierPackaging;

    private String operationType;

    private ReturnablePackaging returnablePackaging;

    private BigDecimal cost;

    private RepackingUnit unit;
}
