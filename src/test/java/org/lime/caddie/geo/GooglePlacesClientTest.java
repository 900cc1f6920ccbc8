package org.lime.caddie.geo;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lime.caddie.store.TargetCategory;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GooglePlacesClientTest {

    private static final String NEARBY = """
            {"status":"OK","results":[
              {"name":"Green's Beverages","vicinity":"2625 Piedmont Rd NE, Atlanta",
               "types":["liquor_store","store"],"geometry":{"location":{"lat":33.8233,"lng":-84.353}}},
              {"name":"Tower Beer Wine & Spirits","formatted_address":"2161 Piedmont Rd NE, Atlanta, GA 30324",
               "types":["liquor_store"]},
              {"name":"","vicinity":"nowhere"}]}
            """;

    private final List<ClientRequest> requests = new ArrayList<>();
    private final AtomicInteger attempts = new AtomicInteger();
    private GeoProperties properties;

    @BeforeEach
    void setUp() {
        properties = new GeoProperties();
        properties.setApiKey("test-key");
        properties.setBaseUrl("https://maps.example.test");
        properties.setRetryBackoffMs(1);
    }

    @Test
    void parsesCandidatesAndSkipsNamelessOnes() {
        GooglePlacesClient client = client(Mono.defer(() -> GoogleGeocodingClientTest.json(HttpStatus.OK, NEARBY)));

        List<PlaceCandidate> candidates = client.nearby(33.68, -84.45, 16093, TargetCategory.SPIRITS);

        assertThat(candidates).extracting(PlaceCandidate::name)
                .containsExactly("Green's Beverages", "Tower Beer Wine & Spirits");
        assertThat(candidates.get(0).address()).isEqualTo("2625 Piedmont Rd NE, Atlanta");
        assertThat(candidates.get(0).types()).contains("liquor_store");
        assertThat(candidates.get(0).lat()).isEqualTo(33.8233);
        assertThat(candidates.get(1).address()).isEqualTo("2161 Piedmont Rd NE, Atlanta, GA 30324");
        assertThat(candidates.get(1).lat()).isNull();
    }

    @Test
    void queryCarriesRadiusTypeAndKeywordForTheCategory() {
        GooglePlacesClient client = client(Mono.defer(() -> GoogleGeocodingClientTest.json(HttpStatus.OK, "{\"status\":\"ZERO_RESULTS\"}")));

        assertThat(client.nearby(33.68, -84.45, 40000, TargetCategory.CIGARS)).isEmpty();

        String query = requests.get(0).url().getQuery();
        assertThat(requests.get(0).url().getPath()).isEqualTo("/maps/api/place/nearbysearch/json");
        assertThat(query).contains("location=33.68,-84.45", "radius=40000", "type=store", "keyword=cigar shop");
    }

    @Test
    void errorStatusIsAnOutage() {
        GooglePlacesClient client = client(Mono.defer(() -> GoogleGeocodingClientTest.json(HttpStatus.OK, "{\"status\":\"OVER_QUERY_LIMIT\"}")));

        assertThatThrownBy(() -> client.nearby(33.68, -84.45, 16093, TargetCategory.SPIRITS))
                .isInstanceOf(UpstreamUnavailableException.class);
    }

    @Test
    void missingKeyFailsWithoutCallingOut() {
        properties.setApiKey(null);
        GooglePlacesClient client = client(Mono.defer(() -> GoogleGeocodingClientTest.json(HttpStatus.OK, NEARBY)));

        assertThatThrownBy(() -> client.nearby(33.68, -84.45, 16093, TargetCategory.SPIRITS))
                .isInstanceOf(UpstreamUnavailableException.class);
        assertThat(attempts).hasValue(0);
    }

    private GooglePlacesClient client(Mono<ClientResponse> response) {
        WebClient webClient = WebClient.builder()
                .baseUrl(properties.getBaseUrl())
                .exchangeFunction(request -> {
                    attempts.incrementAndGet();
                    requests.add(request);
                    return response;
                })
                .build();
        return new GooglePlacesClient(webClient, properties, new UpstreamCallPolicy(properties));
    }
}
