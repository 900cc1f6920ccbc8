package org.lime.caddie.store;

import org.lime.caddie.geo.GeoLocation;
import org.lime.caddie.geo.GooglePlacesClient;
import org.lime.caddie.geo.GoogleGeocodingClient;
import org.lime.caddie.geo.PlaceCandidate;
import org.lime.caddie.geo.PostalCodes;
import org.lime.caddie.geo.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the store list for a hunt: curated picks first, then filtered and ranked live results,
 * de-duplicated by name and capped by search breadth. Never throws for upstream outages.
 */
@Service
public class StoreResolutionService {

    private static final Logger log = LoggerFactory.getLogger(StoreResolutionService.class);

    private final CuratedStoreCatalog curatedCatalog;
    private final GoogleGeocodingClient geocodingClient;
    private final GooglePlacesClient placesClient;
    private final StoreSearchProperties properties;

    public StoreResolutionService(CuratedStoreCatalog curatedCatalog,
                                  GoogleGeocodingClient geocodingClient,
                                  GooglePlacesClient placesClient,
                                  StoreSearchProperties properties) {
        this.curatedCatalog = curatedCatalog;
        this.geocodingClient = geocodingClient;
        this.placesClient = placesClient;
        this.properties = properties;
    }

    public StoreResolution resolveStores(String areaHint, TargetCategory category) {
        String hint = areaHint == null ? "" : areaHint.trim();
        TargetCategory target = category == null ? TargetCategory.SPIRITS : category;
        SearchBreadth breadth = PostalCodes.containsPostalCode(hint) ? SearchBreadth.LOCAL : SearchBreadth.BROAD;
        int cap = properties.capFor(breadth);

        List<StoreRecord> curated = curatedCatalog.lookup(hint, target);

        Optional<GeoLocation> location;
        try {
            location = geocodingClient.geocode(hint);
        } catch (UpstreamUnavailableException ex) {
            log.warn("[StoreResolutionService] Geocoding failed for '{}', serving curated stores only: {}", hint, ex.getMessage());
            return new StoreResolution(hint, cap(dedupe(curated), cap), breadth, true, null);
        }
        if (location.isEmpty()) {
            log.info("[StoreResolutionService] No geocode match for '{}', serving curated stores only", hint);
            return new StoreResolution(hint, cap(dedupe(curated), cap), breadth, false, null);
        }

        GeoLocation point = location.get();
        if (curated.isEmpty()) {
            curated = curatedCatalog.lookup(point.label(), target);
        }

        boolean degraded = false;
        List<PlaceCandidate> candidates;
        try {
            candidates = placesClient.nearby(point.lat(), point.lng(), properties.radiusFor(breadth), target);
        } catch (UpstreamUnavailableException ex) {
            log.warn("[StoreResolutionService] Places search failed near '{}': {}", point.label(), ex.getMessage());
            candidates = List.of();
            degraded = true;
        }

        List<PlaceCandidate> accepted = new ArrayList<>();
        for (PlaceCandidate candidate : candidates) {
            if (VenueFilter.passes(candidate, target)) {
                accepted.add(candidate);
            }
        }
        accepted.sort(Comparator.comparingInt((PlaceCandidate it) -> VenueFilter.score(it, target)).reversed());

        List<StoreRecord> merged = new ArrayList<>(curated);
        accepted.stream().map(StoreResolutionService::toRecord).forEach(merged::add);
        List<StoreRecord> stores = cap(dedupe(merged), cap);
        log.info("[StoreResolutionService] {} stores for '{}' ({} curated, {} live accepted of {}, breadth {})",
                stores.size(), point.label(), curated.size(), accepted.size(), candidates.size(), breadth);
        String label = StringUtils.hasText(point.label()) ? point.label() : hint;
        return new StoreResolution(label, stores, breadth, degraded, point.stateCode());
    }

    static String dedupeKey(String name) {
        return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static List<StoreRecord> dedupe(List<StoreRecord> stores) {
        Map<String, StoreRecord> unique = new LinkedHashMap<>();
        for (StoreRecord store : stores) {
            if (store.name() == null || store.name().isBlank()) {
                continue;
            }
            unique.putIfAbsent(dedupeKey(store.name()), store);
        }
        return new ArrayList<>(unique.values());
    }

    private static List<StoreRecord> cap(List<StoreRecord> stores, int cap) {
        return List.copyOf(stores.size() > cap ? stores.subList(0, cap) : stores);
    }

    private static StoreRecord toRecord(PlaceCandidate candidate) {
        return StoreRecord.builder()
                .name(candidate.name().trim())
                .address(candidate.address())
                .lat(candidate.lat())
                .lng(candidate.lng())
                .notes("Found via live search. Call ahead about allocation drops.")
                .provenance(Provenance.LIVE)
                .build();
    }
}
