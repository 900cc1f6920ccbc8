package org.lime.caddie.store;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "caddie.stores")
public class StoreSearchProperties {

    private int localRadiusMeters = 16093;
    private int localCap = 6;
    private int broadRadiusMeters = 40000;
    private int broadCap = 10;
    private String curatedResource = "classpath:curated-stores.json";

    public int radiusFor(SearchBreadth breadth) {
        return breadth == SearchBreadth.LOCAL ? localRadiusMeters : broadRadiusMeters;
    }

    public int capFor(SearchBreadth breadth) {
        return breadth == SearchBreadth.LOCAL ? localCap : broadCap;
    }
}
