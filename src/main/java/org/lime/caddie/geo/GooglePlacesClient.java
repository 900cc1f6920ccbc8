package org.lime.caddie.geo;

import com.fasterxml.jackson.databind.JsonNode;
import org.lime.caddie.store.TargetCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.ArrayList;
import java.util.List;

@Service
public class GooglePlacesClient {

    private static final Logger log = LoggerFactory.getLogger(GooglePlacesClient.class);
    private static final String NEARBY_PATH = "/maps/api/place/nearbysearch/json";

    private final WebClient webClient;
    private final GeoProperties properties;
    private final UpstreamCallPolicy callPolicy;

    public GooglePlacesClient(WebClient mapsWebClient, GeoProperties properties, UpstreamCallPolicy callPolicy) {
        this.webClient = mapsWebClient;
        this.properties = properties;
        this.callPolicy = callPolicy;
    }

    public List<PlaceCandidate> nearby(double lat, double lng, int radiusMeters, TargetCategory category) {
        if (!properties.hasApiKey()) {
            throw new UpstreamUnavailableException("Places API key is not configured");
        }
        JsonNode body = callPolicy.execute("places", webClient.get()
                .uri(uri -> uri.path(NEARBY_PATH)
                        .queryParam("location", lat + "," + lng)
                        .queryParam("radius", radiusMeters)
                        .queryParam("type", category.placeType())
                        .queryParam("keyword", category.searchKeyword())
                        .queryParam("key", properties.getApiKey())
                        .build())
                .retrieve()
                .bodyToMono(JsonNode.class));

        List<PlaceCandidate> candidates = parse(body);
        log.debug("[GooglePlacesClient] {} candidates for {} within {}m", candidates.size(), category.key(), radiusMeters);
        return candidates;
    }

    private static List<PlaceCandidate> parse(JsonNode body) {
        if (body == null) {
            throw new UpstreamUnavailableException("Places returned an empty body");
        }
        String status = body.path("status").asText("");
        if ("ZERO_RESULTS".equals(status)) {
            return List.of();
        }
        if (!"OK".equals(status)) {
            throw new UpstreamUnavailableException("Places returned status " + status);
        }
        List<PlaceCandidate> candidates = new ArrayList<>();
        for (JsonNode result : body.path("results")) {
            String name = result.path("name").asText("");
            if (name.isBlank()) {
                continue;
            }
            String address = result.hasNonNull("vicinity")
                    ? result.path("vicinity").asText()
                    : result.path("formatted_address").asText("");
            List<String> types = new ArrayList<>();
            result.path("types").forEach(type -> types.add(type.asText()));
            JsonNode point = result.path("geometry").path("location");
            candidates.add(new PlaceCandidate(
                    name,
                    address,
                    types,
                    point.has("lat") ? point.path("lat").asDouble() : null,
                    point.has("lng") ? point.path("lng").asDouble() : null
            ));
        }
        return candidates;
    }
}
