package com.lynkvertx.lcce.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepackingConfig {

    /** Derived from the piece weight when absent */
    private PieceWeightCategory weightCategory;

    @Builder.Default
    private SupplierPackaging supplierPackaging = SupplierPackaging.NOT_APPLICABLE;

    @Builder.Default
    private ReturnablePackaging returnablePackaging = ReturnablePackaging.NOT_APPLICABLE;
}
