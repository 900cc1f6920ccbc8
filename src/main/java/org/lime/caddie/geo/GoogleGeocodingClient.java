package org.lime.caddie.geo;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class GoogleGeocodingClient {

    private static final Logger log = LoggerFactory.getLogger(GoogleGeocodingClient.class);
    private static final String GEOCODE_PATH = "/maps/api/geocode/json";

    private final WebClient webClient;
    private final GeoProperties properties;
    private final UpstreamCallPolicy callPolicy;
    private final Map<String, GeoLocation> cache = new ConcurrentHashMap<>();

    public GoogleGeocodingClient(WebClient mapsWebClient, GeoProperties properties, UpstreamCallPolicy callPolicy) {
        this.webClient = mapsWebClient;
        this.properties = properties;
        this.callPolicy = callPolicy;
    }

    public Optional<GeoLocation> geocode(String query) {
        if (!StringUtils.hasText(query)) {
            return Optional.empty();
        }
        String address = query.trim();
        String cacheKey = address.toLowerCase(Locale.ROOT);
        GeoLocation cached = cache.get(cacheKey);
        if (cached != null) {
            return Optional.of(cached);
        }
        if (!properties.hasApiKey()) {
            throw new UpstreamUnavailableException("Geocoding API key is not configured");
        }
        String components = PostalCodes.isPostalCode(address)
                ? "postal_code:" + PostalCodes.find(address).orElse(address) + "|country:US"
                : "country:US";

        JsonNode body = callPolicy.execute("geocode", webClient.get()
                .uri(uri -> uri.path(GEOCODE_PATH)
                        .queryParam("address", address)
                        .queryParam("components", components)
                        .queryParam("key", properties.getApiKey())
                        .build())
                .retrieve()
                .bodyToMono(JsonNode.class));

        Optional<GeoLocation> location = parse(body);
        location.ifPresent(it -> cache.put(cacheKey, it));
        log.debug("[GoogleGeocodingClient] '{}' resolved to {}", address, location.map(GeoLocation::label).orElse("nothing"));
        return location;
    }

    public void evict() {
        cache.clear();
    }

    private static Optional<GeoLocation> parse(JsonNode body) {
        if (body == null) {
            throw new UpstreamUnavailableException("Geocoding returned an empty body");
        }
        String status = body.path("status").asText("");
        if ("ZERO_RESULTS".equals(status)) {
            return Optional.empty();
        }
        if (!"OK".equals(status)) {
            throw new UpstreamUnavailableException("Geocoding returned status " + status);
        }
        JsonNode first = body.path("results").path(0);
        if (first.isMissingNode()) {
            return Optional.empty();
        }
        JsonNode point = first.path("geometry").path("location");
        if (!point.has("lat") || !point.has("lng")) {
            return Optional.empty();
        }
        return Optional.of(new GeoLocation(
                point.path("lat").asDouble(),
                point.path("lng").asDouble(),
                first.path("formatted_address").asText(""),
                stateCode(first.path("address_components"))
        ));
    }

    private static String stateCode(JsonNode components) {
        for (JsonNode component : components) {
            for (JsonNode type : component.path("types")) {
                if ("administrative_area_level_1".equals(type.asText())) {
                    return component.path("short_name").asText(null);
                }
            }
        }
        return null;
    }
}
