package com.phillippitts.aura.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param location Spring resource location of the patient records JSON
 */
@ConfigurationProperties(prefix = "aura.patients")
public record PatientStoreProperties(String location) {

    public static final String DEFAULT_LOCATION = "classpath:patients.json";

    public PatientStoreProperties {
        location = location == null || location.isBlank() ? DEFAULT_LOCATION : location;
    }
}
