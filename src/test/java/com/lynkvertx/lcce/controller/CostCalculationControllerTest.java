package com.lynkvertx.lcce.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lynkvertx.lcce.dto.BatchCalculationRequestDTO;
import com.lynkvertx.lcce.dto.CostCalculationRequestDTO;
import com.lynkvertx.lcce.model.BoxType;
import com.lynkvertx.lcce.model.Co2Config;
import com.lynkvertx.lcce.model.Incoterm;
import com.lynkvertx.lcce.model.LoopStages;
import com.lynkvertx.lcce.model.Material;
import com.lynkvertx.lcce.model.OperationsConfig;
import com.lynkvertx.lcce.model.PackagingConfig;
import com.lynkvertx.lcce.model.PalletType;
import com.lynkvertx.lcce.model.Supplier;
import com.lynkvertx.lcce.model.TransportConfig;
import com.lynkvertx.lcce.model.TransportMode;
import com.lynkvertx.lcce.model.WarehouseConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;

import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class CostCalculationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void calculate_returnsItemizedCost() throws Exception {
        mockMvc.perform(post("/api/calculations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request("M-100"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.materialNo").value("M-100"))
                .andExpect(jsonPath("$.data.destinationPlant").value("Munich"))
                .andExpect(jsonPath("$.data.transportCostPerPiece").value(closeTo(0.1, 1e-9)))
                .andExpect(jsonPath("$.data.totalCostPerPiece").value(closeTo(0.127, 1e-9)))
                .andExpect(jsonPath("$.data.calculationSteps").isNotEmpty());
    }

    @Test
    void calculate_blankMaterialNumber_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/calculations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request(" "))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400))
                .andExpect(jsonPath("$.data['material.materialNo']").value("Material number is required"));
    }

    @Test
    void calculate_missingTransport_isBadRequest() throws Exception {
        CostCalculationRequestDTO request = request("M-100");
        request.setTransport(null);

        mockMvc.perform(post("/api/calculations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("TransportConfig")));
    }

    @Test
    void calculate_unknownTransportMode_isBadRequest() throws Exception {
        String body = objectMapper.writeValueAsString(request("M-100")).replace("\"ROAD\"", "\"AIR\"");

        mockMvc.perform(post("/api/calculations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("Malformed request")));
    }

    @Test
    void batch_skipsIncompletePairs() throws Exception {
        CostCalculationRequestDTO incomplete = request("M-200");
        incomplete.setPackaging(null);
        BatchCalculationRequestDTO batch = new BatchCalculationRequestDTO(List.of(request("M-100"), incomplete));

        mockMvc.perform(post("/api/calculations/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(batch)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Batch calculation completed: 1 of 2 pairs calculated"))
                .andExpect(jsonPath("$.data.results[0].materialNo").value("M-100"))
                .andExpect(jsonPath("$.data.skippedPairs[0]").value("M-200/V-200"));
    }

    @Test
    void batch_nullPairEntry_isSkipped() throws Exception {
        String body = "{\"pairs\":[" + objectMapper.writeValueAsString(request("M-100")) + ",null]}";

        mockMvc.perform(post("/api/calculations/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Batch calculation completed: 1 of 2 pairs calculated"))
                .andExpect(jsonPath("$.data.skippedPairs[0]").value("?/?"));
    }

    @Test
    void batch_emptyPairs_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/calculations/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pairs\":[]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void referenceData_listsBoxCatalog() throws Exception {
        mockMvc.perform(get("/api/reference-data/boxes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.KLT_6280.unitPrice").value(closeTo(1.2, 1e-9)))
                .andExpect(jsonPath("$.data.KLT_6280.unitsPerLogisticsUnit").value(20));
    }

    @Test
    void referenceData_filtersLanesByOrigin() throws Exception {
        mockMvc.perform(get("/api/reference-data/lanes").param("originCountry", "pl"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].laneId").value("L-0002"));
    }

    private static CostCalculationRequestDTO request(String materialNo) {
        return CostCalculationRequestDTO.builder()
            .material(Material.builder()
                .materialNo(materialNo)
                .weightPerPieceKg(new BigDecimal("0.50"))
                .annualVolume(120_000L)
                .dailyDemand(new BigDecimal("480"))
                .lifetimeYears(new BigDecimal("5"))
                .piecePrice(new BigDecimal("2.00"))
                .build())
            .supplier(Supplier.builder()
                .vendorId("V-200")
                .country("DE")
                .zipCode("71063")
                .deliveriesPerMonth(4)
                .distanceKm(new BigDecimal("220"))
                .build())
            .packaging(PackagingConfig.builder()
                .boxType(BoxType.KLT_6280)
                .fillQtyBox(50)
                .palletType(PalletType.EUR_PALLET)
                .fillQtyLuOversea(1000)
                .loopStages(LoopStages.builder().goodsReceipt(4).production(5).transitToPlant(5).build())
                .build())
            .transport(TransportConfig.builder()
                .mode(TransportMode.ROAD)
                .costPerLu(new BigDecimal("100"))
                .stackabilityFactor(BigDecimal.ONE)
                .build())
            .operations(OperationsConfig.builder().incoterm(Incoterm.FCA).leadTimeDays(10).build())
            .warehouse(WarehouseConfig.builder().costPerLocation(new BigDecimal("30")).build())
            .co2(Co2Config.builder().costPerTon(new BigDecimal("100")).conversionFactor(new BigDecimal("3.17")).build())
            .build();
    }
}
