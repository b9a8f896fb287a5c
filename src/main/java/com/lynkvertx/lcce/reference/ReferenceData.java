package com.lynkvertx.lcce.reference;

import com.lynkvertx.lcce.model.BoxType;
import com.lynkvertx.lcce.model.PalletAccessory;
import com.lynkvertx.lcce.model.PalletType;
import com.lynkvertx.lcce.model.SpecialPackagingVariant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reference table document as stored in reference-data.json.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReferenceData {

    @Builder.Default
    private Map<BoxType, PackagingItem> boxes = new EnumMap<>(BoxType.class);

    @Builder.Default
    private Map<PalletType, PackagingItem> pallets = new EnumMap<>(PalletType.class);

    @Builder.Default
    private Map<SpecialPackagingVariant, PackagingItem> trays = new EnumMap<>(SpecialPackagingVariant.class);

    @Builder.Default
    private Map<PalletAccessory, PackagingItem> accessories = new EnumMap<>(PalletAccessory.class);

    @Builder.Default
    private List<RepackingRate> repackingRates = new ArrayList<>();

    @Builder.Default
    private List<TransportLane> lanes = new ArrayList<>();
}
