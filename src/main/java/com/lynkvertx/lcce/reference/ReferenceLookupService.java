package com.lynkvertx.lcce.reference;

import com.lynkvertx.lcce.model.BoxType;
import com.lynkvertx.lcce.model.PalletAccessory;
import com.lynkvertx.lcce.model.PalletType;
import com.lynkvertx.lcce.model.PieceWeightCategory;
import com.lynkvertx.lcce.model.ReturnablePackaging;
import com.lynkvertx.lcce.model.SpecialPackagingVariant;
import com.lynkvertx.lcce.model.SupplierPackaging;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only access to the packaging catalogs, the repacking price table and the transport lane table.
 * Implementations must be safe to share between concurrent calculations.
 */
public interface ReferenceLookupService {

    Optional<PackagingItem> box(BoxType type);

    Optional<PackagingItem> pallet(PalletType type);

    Optional<PackagingItem> tray(SpecialPackagingVariant variant);

    Optional<PackagingItem> accessory(PalletAccessory accessory);

    Optional<RepackingRate> repackingRate(PieceWeightCategory weightCategory,
                                          SupplierPackaging supplierPackaging,
                                          ReturnablePackaging returnablePackaging);

    /**
     * Find the lane between two locations, matching on the full zip codes first
     * and on the zip code prefixes second.
     */
    Optional<TransportLane> lane(String originCountry, String originZip,
                                 String destinationCountry, String destinationZip);

    Map<BoxType, PackagingItem> boxes();

    Map<PalletType, PackagingItem> pallets();

    List<RepackingRate> repackingRates();

    List<TransportLane> lanes();
}
