package com.lynkvertx.lcce.controller;

import com.lynkvertx.lcce.dto.ApiResponse;
import com.lynkvertx.lcce.model.BoxType;
import com.lynkvertx.lcce.model.PalletType;
import com.lynkvertx.lcce.reference.PackagingItem;
import com.lynkvertx.lcce.reference.ReferenceLookupService;
import com.lynkvertx.lcce.reference.RepackingRate;
import com.lynkvertx.lcce.reference.TransportLane;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only access to the reference tables used by the calculation
 */
@RestController
@RequestMapping("/api/reference-data")
@RequiredArgsConstructor
@Tag(name = "Reference Data", description = "Packaging catalogs, repacking rates and transport lanes")
public class ReferenceDataController {

    private final ReferenceLookupService referenceLookup;

    @GetMapping("/boxes")
    @Operation(summary = "List boxes", description = "Box catalog keyed by box type")
    public ResponseEntity<ApiResponse<Map<BoxType, PackagingItem>>> getBoxes() {
        return ResponseEntity.ok(ApiResponse.success("Success", referenceLookup.boxes()));
    }

    @GetMapping("/pallets")
    @Operation(summary = "List pallets", description = "Pallet catalog keyed by pallet type")
    public ResponseEntity<ApiResponse<Map<PalletType, PackagingItem>>> getPallets() {
        return ResponseEntity.ok(ApiResponse.success("Success", referenceLookup.pallets()));
    }

    @GetMapping("/repacking-rates")
    @Operation(summary = "List repacking rates", description = "Repacking operation price table")
    public ResponseEntity<ApiResponse<List<RepackingRate>>> getRepackingRates() {
        return ResponseEntity.ok(ApiResponse.success("Success", referenceLookup.repackingRates()));
    }

    @GetMapping("/lanes")
    @Operation(summary = "List transport lanes", description = "Transport lanes, optionally filtered by origin and destination country")
    public ResponseEntity<ApiResponse<List<TransportLane>>> getLanes(
            @RequestParam(required = false) String originCountry,
            @RequestParam(required = false) String destinationCountry) {
        List<TransportLane> lanes = referenceLookup.lanes().stream()
            .filter(lane -> originCountry == null || originCountry.equalsIgnoreCase(lane.getOriginCountry()))
            .filter(lane -> destinationCountry == null || destinationCountry.equalsIgnoreCase(lane.getDestinationCountry()))
            .collect(Collectors.toList());
        return ResponseEntity.ok(ApiResponse.success("Success", lanes));
    }
}
