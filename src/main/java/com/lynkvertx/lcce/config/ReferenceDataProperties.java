package com.lynkvertx.lcce.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "lcce.reference-data")
public class ReferenceDataProperties {

    /** Spring resource location of the reference table document */
    private String location = "classpath:reference-data.json";
}
