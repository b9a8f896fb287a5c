package com.lynkvertx.lcce.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Receiving plant (destination of the transport lane).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Location {

    private String plant;

    private String country;

    private String zipCode;
}
