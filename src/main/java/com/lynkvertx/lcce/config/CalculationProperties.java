package com.lynkvertx.lcce.config;

import com.lynkvertx.lcce.model.Incoterm;
import com.lynkvertx.lcce.model.Location;
import com.lynkvertx.lcce.model.TransportMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for the logistics cost calculation.
 * All constants of the cost formulas are externalized here,
 * making the calculation engine fully configurable via application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "lcce.calculation")
public class CalculationProperties {

    /** Days per month used to derive the monthly demand from the daily demand */
    private int daysPerMonth = 30;

    private int monthsPerYear = 12;

    /** Decimal places of the per-piece cost figures (rounded up) */
    private int perPieceScale = 3;

    /** Plant box quantities are rounded up to a multiple of this value */
    private int plantBoxRoundingMultiple = 10;

    /** Scrapping cost factor applied to the weight of wooden boxes */
    private BigDecimal woodScrapFactor = new BigDecimal("160");

    /** Days of stock covered by the local storage locations */
    private BigDecimal localStorageDays = new BigDecimal("5");

    /** Loading meters taken by one pallet footprint */
    private BigDecimal palletFootprintLdm = new BigDecimal("0.4");

    /** Euro pallets per full truck */
    private int palletsPerTruck = 34;

    /** Space based rate per loading meter for cross-border lanes */
    private BigDecimal spaceRateInternational = new BigDecimal("1500");

    /** Space based rate per loading meter for domestic lanes */
    private BigDecimal spaceRateDomestic = new BigDecimal("800");

    /** Zip code characters compared when no exact lane exists */
    private int zipPrefixLength = 2;

    /** Incoterms for which sea freight is charged the bonded warehouse leg */
    private Set<Incoterm> bondedIncoterms = EnumSet.of(Incoterm.FCA, Incoterm.FOB);

    /** Energy consumption factor per ton-km by transport mode */
    private Map<TransportMode, BigDecimal> energyFactors = defaultEnergyFactors();

    /** Receiving plant used when a pair carries no location */
    private Location defaultLocation = defaultLocation();

    /** Evaluate batch pairs on the common fork-join pool */
    private boolean parallelBatch = true;

    private static Map<TransportMode, BigDecimal> defaultEnergyFactors() {
        Map<TransportMode, BigDecimal> map = new EnumMap<>(TransportMode.class);
        map.put(TransportMode.SEA, new BigDecimal("0.006"));
        map.put(TransportMode.ROAD, new BigDecimal("0.04415"));
        map.put(TransportMode.RAIL, new BigDecimal("0.0085"));
        return map;
    }

    private static Location defaultLocation() {
        return Location.builder()
            .plant("Munich")
            .country("DE")
            .zipCode("80809")
            .build();
    }
}
