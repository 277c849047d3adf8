package com.example.recordsapi.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Cross-origin settings bound from application.yml (records.cors.*). The defaults let any
 * browser front end call the API.
 */
@ConfigurationProperties(prefix = "records.cors")
@Data
public class CorsProperties {

    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
    private long maxAgeSeconds = 3600;
}
