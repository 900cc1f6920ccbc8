package org.lime.caddie.geo;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@Data
@ConfigurationProperties(prefix = "caddie.geo")
public class GeoProperties {

    private String apiKey;
    private String baseUrl = "https://maps.googleapis.com";
    private long timeoutMs = 3000;
    private int maxRetries = 1;
    private long retryBackoffMs = 200;

    public boolean hasApiKey() {
        return StringUtils.hasText(apiKey);
    }
}
