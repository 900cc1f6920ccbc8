package org.lime.caddie.geo;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GoogleGeocodingClientTest {

    private static final String EAST_POINT = """
            {"status":"OK","results":[{"formatted_address":"East Point, GA 30344, USA",
              "geometry":{"location":{"lat":33.679,"lng":-84.4511}},
              "address_components":[
                {"long_name":"30344","short_name":"30344","types":["postal_code"]},
                {"long_name":"Georgia","short_name":"GA","types":["administrative_area_level_1","political"]}]}]}
            """;

    private final AtomicInteger attempts = new AtomicInteger();
    private final List<ClientRequest> requests = new ArrayList<>();
    private GeoProperties properties;

    @BeforeEach
    void setUp() {
        properties = new GeoProperties();
        properties.setApiKey("test-key");
        properties.setBaseUrl("https://maps.example.test");
        properties.setTimeoutMs(2000);
        properties.setMaxRetries(1);
        properties.setRetryBackoffMs(1);
    }

    @Test
    void bareZipIsSentAsPostalComponent() {
        GoogleGeocodingClient client = client(request -> json(HttpStatus.OK, EAST_POINT));

        Optional<GeoLocation> location = client.geocode("30344");

        assertThat(location).isPresent();
        assertThat(location.get().lat()).isEqualTo(33.679);
        assertThat(location.get().label()).isEqualTo("East Point, GA 30344, USA");
        assertThat(location.get().stateCode()).isEqualTo("GA");
        String query = requests.get(0).url().getQuery();
        assertThat(requests.get(0).url().getPath()).isEqualTo("/maps/api/geocode/json");
        assertThat(query).contains("components=postal_code:30344|country:US").contains("key=test-key");
    }

    @Test
    void freeTextIsRestrictedToTheCountryOnly() {
        GoogleGeocodingClient client = client(request -> json(HttpStatus.OK, EAST_POINT));

        client.geocode("Dallas, TX");

        assertThat(requests.get(0).url().getQuery()).contains("address=Dallas, TX").contains("components=country:US");
    }

    @Test
    void serverErrorIsRetriedOnce() {
        GoogleGeocodingClient client = client(request -> attempts.get() == 1
                ? Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build())
                : json(HttpStatus.OK, EAST_POINT));

        assertThat(client.geocode("30344")).isPresent();
        assertThat(attempts).hasValue(2);
    }

    @Test
    void connectionFailureExhaustsRetriesThenSurfacesAsUnavailable() {
        GoogleGeocodingClient client = client(request -> Mono.error(new ConnectException("refused")));

        assertThatThrownBy(() -> client.geocode("30344")).isInstanceOf(UpstreamUnavailableException.class);
        assertThat(attempts).hasValue(2);
    }

    @Test
    void clientErrorIsNotRetried() {
        GoogleGeocodingClient client = client(request -> Mono.just(ClientResponse.create(HttpStatus.BAD_REQUEST).build()));

        assertThatThrownBy(() -> client.geocode("30344")).isInstanceOf(UpstreamUnavailableException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    void zeroResultsIsAMissNotAFailure() {
        GoogleGeocodingClient client = client(request -> json(HttpStatus.OK, "{\"status\":\"ZERO_RESULTS\",\"results\":[]}"));

        assertThat(client.geocode("Unknown Place")).isEmpty();
    }

    @Test
    void deniedRequestIsAnOutage() {
        GoogleGeocodingClient client = client(request -> json(HttpStatus.OK, "{\"status\":\"REQUEST_DENIED\"}"));

        assertThatThrownBy(() -> client.geocode("30344")).isInstanceOf(UpstreamUnavailableException.class);
    }

    @Test
    void missingKeyFailsWithoutCallingOut() {
        properties.setApiKey("");
        GoogleGeocodingClient client = client(request -> json(HttpStatus.OK, EAST_POINT));

        assertThatThrownBy(() -> client.geocode("30344")).isInstanceOf(UpstreamUnavailableException.class);
        assertThat(attempts).hasValue(0);
    }

    @Test
    void successfulLookupsAreCachedCaseInsensitively() {
        GoogleGeocodingClient client = client(request -> json(HttpStatus.OK, EAST_POINT));

        client.geocode("Atlanta");
        client.geocode("  ATLANTA ");
        assertThat(attempts).hasValue(1);

        client.evict();
        client.geocode("atlanta");
        assertThat(attempts).hasValue(2);
    }

    private GoogleGeocodingClient client(Function<ClientRequest, Mono<ClientResponse>> responder) {
        ExchangeFunction exchange = request -> {
            attempts.incrementAndGet();
            requests.add(request);
            return responder.apply(request);
        };
        WebClient webClient = WebClient.builder()
                .baseUrl(properties.getBaseUrl())
                .exchangeFunction(exchange)
                .build();
        return new GoogleGeocodingClient(webClient, properties, new UpstreamCallPolicy(properties));
    }

    static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }
}
