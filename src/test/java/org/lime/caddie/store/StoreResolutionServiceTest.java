package org.lime.caddie.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lime.caddie.geo.GeoLocation;
import org.lime.caddie.geo.GooglePlacesClient;
import org.lime.caddie.geo.GoogleGeocodingClient;
import org.lime.caddie.geo.PlaceCandidate;
import org.lime.caddie.geo.UpstreamUnavailableException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class StoreResolutionServiceTest {

    private static final GeoLocation ATLANTA_30344 = new GeoLocation(33.6790, -84.4511, "East Point, GA 30344, USA", "GA");

    private GoogleGeocodingClient geocodingClient;
    private GooglePlacesClient placesClient;
    private StoreResolutionService service;

    @BeforeEach
    void setUp() {
        geocodingClient = mock(GoogleGeocodingClient.class);
        placesClient = mock(GooglePlacesClient.class);
        CuratedStoreCatalog catalog = new CuratedStoreCatalog(Map.of(TargetCategory.SPIRITS, new CuratedStoreCatalog.CuratedTable(
                Map.of("atlanta", "atlanta_ga", "30344", "atlanta_ga"),
                Map.of("atlanta_ga", List.of(
                        curated("Green's Beverages", "(404) 233-3845"),
                        curated("Tower Beer Wine & Spirits", "(404) 233-5432"))))));
        service = new StoreResolutionService(catalog, geocodingClient, placesClient, new StoreSearchProperties());
    }

    @Test
    void curatedFirstThenLiveWithDuplicatesRemoved() {
        when(geocodingClient.geocode("30344")).thenReturn(Optional.of(ATLANTA_30344));
        when(placesClient.nearby(anyDouble(), anyDouble(), anyInt(), eq(TargetCategory.SPIRITS))).thenReturn(List.of(
                place("  green's   BEVERAGES ", "liquor_store"),
                place("Peachtree Bourbon & Wine", "liquor_store")));

        StoreResolution resolution = service.resolveStores("30344", TargetCategory.SPIRITS);

        assertThat(resolution.stores()).extracting(StoreRecord::name)
                .containsExactly("Green's Beverages", "Tower Beer Wine & Spirits", "Peachtree Bourbon & Wine");
        assertThat(resolution.stores()).extracting(StoreRecord::provenance)
                .containsExactly(Provenance.CURATED, Provenance.CURATED, Provenance.LIVE);
        assertThat(resolution.stores().get(0).phone()).isEqualTo("(404) 233-3845");
        assertThat(resolution.stores().get(2).notes()).startsWith("Found via live search");
        assertThat(resolution.label()).isEqualTo("East Point, GA 30344, USA");
        assertThat(resolution.stateCode()).isEqualTo("GA");
        assertThat(resolution.breadth()).isEqualTo(SearchBreadth.LOCAL);
        assertThat(resolution.degraded()).isFalse();
    }

    @Test
    void postalCodeSearchesTheLocalRadiusAndCityTheBroadOne() {
        when(geocodingClient.geocode(anyString())).thenReturn(Optional.of(ATLANTA_30344));
        when(placesClient.nearby(anyDouble(), anyDouble(), anyInt(), eq(TargetCategory.SPIRITS))).thenReturn(List.of());

        service.resolveStores("30344", TargetCategory.SPIRITS);
        service.resolveStores("Atlanta, GA", TargetCategory.SPIRITS);

        verify(placesClient).nearby(33.6790, -84.4511, 16093, TargetCategory.SPIRITS);
        verify(placesClient).nearby(33.6790, -84.4511, 40000, TargetCategory.SPIRITS);
    }

    @Test
    void resultsAreCappedByBreadth() {
        when(geocodingClient.geocode(anyString())).thenReturn(Optional.of(ATLANTA_30344));
        List<PlaceCandidate> many = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            many.add(place("Liquor Depot " + i, "liquor_store"));
        }
        when(placesClient.nearby(anyDouble(), anyDouble(), anyInt(), eq(TargetCategory.SPIRITS))).thenReturn(many);

        assertThat(service.resolveStores("30344", TargetCategory.SPIRITS).stores()).hasSize(6);
        assertThat(service.resolveStores("Atlanta, GA", TargetCategory.SPIRITS).stores()).hasSize(10);
    }

    @Test
    void excludedVenuesNeverAppear() {
        when(geocodingClient.geocode("Decatur, GA")).thenReturn(Optional.of(new GeoLocation(33.77, -84.29, "Decatur, GA, USA", "GA")));
        when(placesClient.nearby(anyDouble(), anyDouble(), anyInt(), eq(TargetCategory.SPIRITS))).thenReturn(List.of(
                place("Kroger", "grocery_or_supermarket", "liquor_store"),
                place("Bourbon Street Grill", "restaurant"),
                place("Walgreens Wine", "liquor_store"),
                place("Decatur Package", "liquor_store")));

        StoreResolution resolution = service.resolveStores("Decatur, GA", TargetCategory.SPIRITS);

        assertThat(resolution.stores()).extracting(StoreRecord::name).containsExactly("Decatur Package");
    }

    @Test
    void liveResultsAreRankedByScoreKeepingProviderOrderOnTies() {
        when(geocodingClient.geocode("Decatur, GA")).thenReturn(Optional.of(new GeoLocation(33.77, -84.29, "Decatur, GA, USA", "GA")));
        when(placesClient.nearby(anyDouble(), anyDouble(), anyInt(), eq(TargetCategory.SPIRITS))).thenReturn(List.of(
                place("Decatur Package", "liquor_store"),
                place("Oakhurst Market Wine", "point_of_interest"),
                place("Bourbon Barrel Spirits", "liquor_store"),
                place("Ponce Package", "liquor_store")));

        StoreResolution resolution = service.resolveStores("Decatur, GA", TargetCategory.SPIRITS);

        assertThat(resolution.stores()).extracting(StoreRecord::name)
                .containsExactly("Bourbon Barrel Spirits", "Decatur Package", "Ponce Package", "Oakhurst Market Wine");
    }

    @Test
    void geocodingOutageFallsBackToCuratedWithoutCallingPlaces() {
        when(geocodingClient.geocode("Atlanta")).thenThrow(new UpstreamUnavailableException("geocode", new RuntimeException("timeout")));

        StoreResolution resolution = service.resolveStores("Atlanta", TargetCategory.SPIRITS);

        assertThat(resolution.degraded()).isTrue();
        assertThat(resolution.label()).isEqualTo("Atlanta");
        assertThat(resolution.stores()).extracting(StoreRecord::name)
                .containsExactly("Green's Beverages", "Tower Beer Wine & Spirits");
        verifyNoInteractions(placesClient);
    }

    @Test
    void unknownPlaceWithOutageReturnsNothingButDoesNotThrow() {
        when(geocodingClient.geocode("Unknown Place")).thenThrow(new UpstreamUnavailableException("geocode", new RuntimeException("down")));

        StoreResolution resolution = service.resolveStores("Unknown Place", TargetCategory.SPIRITS);

        assertThat(resolution.stores()).isEmpty();
        assertThat(resolution.degraded()).isTrue();
        assertThat(resolution.breadth()).isEqualTo(SearchBreadth.BROAD);
    }

    @Test
    void geocodeMissIsNotAnOutage() {
        when(geocodingClient.geocode("Nowhere Special")).thenReturn(Optional.empty());

        StoreResolution resolution = service.resolveStores("Nowhere Special", TargetCategory.SPIRITS);

        assertThat(resolution.stores()).isEmpty();
        assertThat(resolution.degraded()).isFalse();
        verifyNoInteractions(placesClient);
    }

    @Test
    void placesOutageKeepsCuratedAndFlagsDegraded() {
        when(geocodingClient.geocode("Atlanta")).thenReturn(Optional.of(new GeoLocation(33.749, -84.388, "Atlanta, GA, USA", "GA")));
        when(placesClient.nearby(anyDouble(), anyDouble(), anyInt(), eq(TargetCategory.SPIRITS)))
                .thenThrow(new UpstreamUnavailableException("places", new RuntimeException("503")));

        StoreResolution resolution = service.resolveStores("Atlanta", TargetCategory.SPIRITS);

        assertThat(resolution.degraded()).isTrue();
        assertThat(resolution.stores()).hasSize(2);
        assertThat(resolution.stateCode()).isEqualTo("GA");
    }

    @Test
    void curatedLookupRetriesOnTheGeocodedLabel() {
        when(geocodingClient.geocode("30318")).thenReturn(Optional.of(new GeoLocation(33.79, -84.44, "Atlanta, GA 30318, USA", "GA")));
        when(placesClient.nearby(anyDouble(), anyDouble(), anyInt(), eq(TargetCategory.SPIRITS))).thenReturn(List.of());

        StoreResolution resolution = service.resolveStores("30318", TargetCategory.SPIRITS);

        assertThat(resolution.stores()).extracting(StoreRecord::name).contains("Green's Beverages");
    }

    @Test
    void dedupeKeyCollapsesCaseAndWhitespace() {
        assertThat(StoreResolutionService.dedupeKey("  Green's   BEVERAGES "))
                .isEqualTo(StoreResolutionService.dedupeKey("Green's Beverages"));
    }

    private static CuratedStoreCatalog.CuratedStore curated(String name, String phone) {
        return new CuratedStoreCatalog.CuratedStore(name, "Piedmont Rd NE, Atlanta, GA 30324", phone, 33.82, -84.35, "list", "Sign up in store.");
    }

    private static PlaceCandidate place(String name, String... types) {
        return new PlaceCandidate(name, "1 Peachtree St, Atlanta, GA", List.of(types), 33.7, -84.4);
    }
}
