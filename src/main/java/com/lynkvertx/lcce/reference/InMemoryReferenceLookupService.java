package com.lynkvertx.lcce.reference;

import com.lynkvertx.lcce.model.BoxType;
import com.lynkvertx.lcce.model.PalletAccessory;
import com.lynkvertx.lcce.model.PalletType;
import com.lynkvertx.lcce.model.PieceWeightCategory;
import com.lynkvertx.lcce.model.ReturnablePackaging;
import com.lynkvertx.lcce.model.SpecialPackagingVariant;
import com.lynkvertx.lcce.model.SupplierPackaging;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reference lookup backed by an immutable snapshot of a {@link ReferenceData} document.
 * Later changes to the document do not reach the snapshot.
 */
public class InMemoryReferenceLookupService implements ReferenceLookupService {

    private final Map<BoxType, PackagingItem> boxes;
    private final Map<PalletType, PackagingItem> pallets;
    private final Map<SpecialPackagingVariant, PackagingItem> trays;
    private final Map<PalletAccessory, PackagingItem> accessories;
    private final List<RepackingRate> repackingRates;
    private final List<TransportLane> lanes;
    private final Map<String, TransportLane> lanesByKey;
    private final int zipPrefixLength;

    public InMemoryReferenceLookupService(ReferenceData data, int zipPrefixLength) {
        this.boxes = Collections.unmodifiableMap(copy(data.getBoxes(), BoxType.class));
        this.pallets = Collections.unmodifiableMap(copy(data.getPallets(), PalletType.class));
        this.trays = Collections.unmodifiableMap(copy(data.getTrays(), SpecialPackagingVariant.class));
        this.accessories = Collections.unmodifiableMap(copy(data.getAccessories(), PalletAccessory.class));
        this.repackingRates = data.getRepackingRates() != null
            ? List.copyOf(data.getRepackingRates()) : List.of();
        this.lanes = data.getLanes() != null ? snapshot(data.getLanes()) : List.of();
        this.zipPrefixLength = zipPrefixLength;
        this.lanesByKey = indexLanes(this.lanes);
    }

    @Override
    public Optional<PackagingItem> box(BoxType type) {
        return type == null ? Optional.empty() : Optional.ofNullable(boxes.get(type));
    }

    @Override
    public Optional<PackagingItem> pallet(PalletType type) {
        return type == null ? Optional.empty() : Optional.ofNullable(pallets.get(type));
    }

    @Override
    public Optional<PackagingItem> tray(SpecialPackagingVariant variant) {
        return variant == null ? Optional.empty() : Optional.ofNullable(trays.get(variant));
    }

    @Override
    public Optional<PackagingItem> accessory(PalletAccessory accessory) {
        return accessory == null ? Optional.empty() : Optional.ofNullable(accessories.get(accessory));
    }

    @Override
    public Optional<RepackingRate> repackingRate(PieceWeightCategory weightCategory,
                                                 SupplierPackaging supplierPackaging,
                                                 ReturnablePackaging returnablePackaging) {
        return repackingRates.stream()
            .filter(rate -> rate.getWeightCategory() == weightCategory
                && rate.getSupplierPackaging() == supplierPackaging
                && rate.getReturnablePackaging() == returnablePackaging)
            .findFirst();
    }

    @Override
    public Optional<TransportLane> lane(String originCountry, String originZip,
                                        String destinationCountry, String destinationZip) {
        String oZip = originZip != null ? originZip.trim() : "";
        String dZip = destinationZip != null ? destinationZip.trim() : "";

        // 1. Exact route key
        TransportLane lane = lanesByKey.get(key(originCountry, oZip, destinationCountry, dZip));
        if (lane != null) {
            return Optional.of(lane);
        }

        // 2. Route key on zip prefixes
        String oPrefix = prefix(oZip);
        String dPrefix = prefix(dZip);
        lane = lanesByKey.get(key(originCountry, oPrefix, destinationCountry, dPrefix));
        if (lane != null) {
            return Optional.of(lane);
        }

        // 3. Lanes stored with longer zip codes
        return lanes.stream()
            .filter(l -> equalsIgnoreCase(l.getOriginCountry(), originCountry)
                && equalsIgnoreCase(l.getDestinationCountry(), destinationCountry)
                && prefix(l.getOriginZip()).equals(oPrefix)
                && prefix(l.getDestinationZip()).equals(dPrefix))
            .findFirst();
    }

    @Override
    public Map<BoxType, PackagingItem> boxes() {
        return boxes;
    }

    @Override
    public Map<PalletType, PackagingItem> pallets() {
        return pallets;
    }

    @Override
    public List<RepackingRate> repackingRates() {
        return repackingRates;
    }

    @Override
    public List<TransportLane> lanes() {
        return lanes;
    }

    private Map<String, TransportLane> indexLanes(List<TransportLane> source) {
        Map<String, TransportLane> index = new HashMap<>();
        for (TransportLane lane : source) {
            index.putIfAbsent(key(lane.getOriginCountry(), nullToEmpty(lane.getOriginZip()),
                lane.getDestinationCountry(), nullToEmpty(lane.getDestinationZip())), lane);
        }
        return Collections.unmodifiableMap(index);
    }

    private static List<TransportLane> snapshot(List<TransportLane> source) {
        return source.stream()
            .map(lane -> lane.toBuilder()
                .weightBrackets(lane.getWeightBrackets() != null ? List.copyOf(lane.getWeightBrackets()) : List.of())
                .build())
            .collect(Collectors.toUnmodifiableList());
    }

    private String prefix(String zip) {
        if (zip == null) {
            return "";
        }
        String trimmed = zip.trim();
        return trimmed.length() > zipPrefixLength ? trimmed.substring(0, zipPrefixLength) : trimmed;
    }

    private static String key(String originCountry, String originZip, String destinationCountry, String destinationZip) {
        return upper(originCountry) + originZip + "-" + upper(destinationCountry) + destinationZip;
    }

    private static String upper(String value) {
        return value != null ? value.trim().toUpperCase() : "";
    }

    private static String nullToEmpty(String value) {
        return value != null ? value.trim() : "";
    }

    private static boolean equalsIgnoreCase(String a, String b) {
        return a != null && b != null && a.trim().equalsIgnoreCase(b.trim());
    }

    private static <K extends Enum<K>> Map<K, PackagingItem> copy(Map<K, PackagingItem> source, Class<K> type) {
        Map<K, PackagingItem> copy = new EnumMap<>(type);
        if (source != null) {
            copy.putAll(source);
        }
        return copy;
    }
}
