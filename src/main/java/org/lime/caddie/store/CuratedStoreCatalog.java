package org.lime.caddie.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class CuratedStoreCatalog {

    private static final Logger log = LoggerFactory.getLogger(CuratedStoreCatalog.class);

    private final Map<TargetCategory, CuratedTable> tables;

    public CuratedStoreCatalog(ResourceLoader resourceLoader, ObjectMapper objectMapper, StoreSearchProperties properties) {
        this(load(resourceLoader.getResource(properties.getCuratedResource()), objectMapper));
    }

    public CuratedStoreCatalog(Map<TargetCategory, CuratedTable> tables) {
        this.tables = new EnumMap<>(TargetCategory.class);
        this.tables.putAll(tables);
    }

    public List<StoreRecord> lookup(String areaHint, TargetCategory category) {
        if (!StringUtils.hasText(areaHint) || category == null) {
            return List.of();
        }
        CuratedTable table = tables.get(category);
        if (table == null || table.aliases() == null) {
            return List.of();
        }
        String lowered = areaHint.toLowerCase(Locale.ROOT);
        return table.aliases().entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, String> it) -> it.getKey().length()).reversed())
                .filter(alias -> lowered.contains(alias.getKey().toLowerCase(Locale.ROOT)))
                .findFirst()
                .map(alias -> toRecords(table.regions().getOrDefault(alias.getValue(), List.of())))
                .orElse(List.of());
    }

    private static List<StoreRecord> toRecords(List<CuratedStore> stores) {
        List<StoreRecord> records = new ArrayList<>(stores.size());
        for (CuratedStore store : stores) {
            records.add(StoreRecord.builder()
                    .name(store.name())
                    .address(store.address())
                    .phone(store.phone())
                    .lat(store.lat())
                    .lng(store.lng())
                    .notes(describe(store))
                    .provenance(Provenance.CURATED)
                    .build());
        }
        return records;
    }

    private static String describe(CuratedStore store) {
        String method = StringUtils.hasText(store.allocationType())
                ? "Allocation: " + store.allocationType().replace('_', ' ') + "."
                : "";
        String notes = store.notes() == null ? "" : store.notes().trim();
        return (method + " " + notes).trim();
    }

    private static Map<TargetCategory, CuratedTable> load(Resource resource, ObjectMapper objectMapper) {
        try (InputStream in = resource.getInputStream()) {
            Map<String, CuratedTable> raw = objectMapper.readValue(in, new TypeReference<Map<String, CuratedTable>>() {
            });
            Map<TargetCategory, CuratedTable> tables = new EnumMap<>(TargetCategory.class);
            raw.forEach((key, table) -> TargetCategory.fromKey(key).ifPresentOrElse(
                    category -> tables.put(category, table),
                    () -> log.warn("[CuratedStoreCatalog] Ignoring unknown category '{}'", key)));
            log.info("[CuratedStoreCatalog] Loaded curated stores for {}", tables.keySet());
            return tables;
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot read curated stores from " + resource.getDescription(), ex);
        }
    }

    public record CuratedTable(Map<String, String> aliases, Map<String, List<CuratedStore>> regions) {

        public CuratedTable {
            aliases = aliases == null ? Map.of() : aliases;
            regions = regions == null ? Map.of() : regions;
        }
    }

    public record CuratedStore(
            String name,
            String address,
            String phone,
            Double lat,
            Double lng,
            @JsonProperty("allocation_type") String allocationType,
            String notes
    ) {
    }
}
