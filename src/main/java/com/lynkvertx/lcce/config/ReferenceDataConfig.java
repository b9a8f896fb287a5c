package com.lynkvertx.lcce.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lynkvertx.lcce.reference.InMemoryReferenceLookupService;
import com.lynkvertx.lcce.reference.ReferenceData;
import com.lynkvertx.lcce.reference.ReferenceDataException;
import com.lynkvertx.lcce.reference.ReferenceLookupService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the reference tables once at start-up and exposes them as a shared read-only lookup service.
 */
@Slf4j
@Configuration
public class ReferenceDataConfig {

    @Bean
    public ReferenceLookupService referenceLookupService(ReferenceDataProperties properties,
                                                         CalculationProperties calculationProperties,
                                                         ResourceLoader resourceLoader,
                                                         ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(properties.getLocation());
        try (InputStream in = resource.getInputStream()) {
            ReferenceData data = objectMapper.readValue(in, ReferenceData.class);
            ReferenceLookupService lookup =
                new InMemoryReferenceLookupService(data, calculationProperties.getZipPrefixLength());
            log.info("Loaded reference data from {}: {} boxes, {} pallets, {} repacking rates, {} lanes",
                properties.getLocation(), lookup.boxes().size(), lookup.pallets().size(),
                lookup.repackingRates().size(), lookup.lanes().size());
            return lookup;
        } catch (IOException e) {
            throw new ReferenceDataException("Failed to load reference data from " + properties.getLocation(), e);
        }
    }
}
