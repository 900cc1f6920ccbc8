package org.lime.caddie.response;

import org.lime.caddie.conversation.Mode;
import org.lime.caddie.store.StoreRecord;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Maps mode outputs, and loosely-shaped drafts from the language model, onto {@link NormalizedResponse}.
 * Normalizing an already normalized response returns an equal value.
 */
@Component
public class ResponseNormalizer {

    private static final String DEFAULT_ITEM_LABEL = "Note";

    public NormalizedResponse normalize(ModeOutput output, Mode routedMode) {
        if (output == null) {
            return normalize((NormalizedResponse) null, routedMode);
        }
        NormalizedResponse.NormalizedResponseBuilder draft = NormalizedResponse.builder().mode(output.mode());
        if (output instanceof ModeOutput.Info info) {
            draft.summary(info.summary())
                    .keyPoints(info.keyPoints())
                    .itemList(info.items())
                    .nextStep(info.nextStep());
        } else if (output instanceof ModeOutput.Pairing pairing) {
            draft.summary(pairing.summary())
                    .keyPoints(pairing.keyPoints())
                    .itemList(pairing.items())
                    .primaryPairing(pairing.primary())
                    .alternativePairings(pairing.alternatives())
                    .nextStep(pairing.nextStep());
        } else if (output instanceof ModeOutput.Hunt hunt) {
            draft.summary(hunt.summary())
                    .keyPoints(hunt.keyPoints())
                    .itemList(hunt.items())
                    .stops(hunt.stops().stream().map(ResponseNormalizer::toStop).collect(Collectors.toList()))
                    .targetBottles(hunt.targetBottles())
                    .storeTargets(hunt.storeTargets())
                    .nextStep(hunt.nextStep());
        } else if (output instanceof ModeOutput.Clarify clarify) {
            draft.summary(clarify.summary())
                    .keyPoints(clarify.keyPoints())
                    .itemList(clarify.examples())
                    .nextStep(clarify.nextStep());
        } else {
            throw new IllegalStateException("Unhandled mode output " + output.getClass().getName());
        }
        return normalize(draft.build(), routedMode);
    }

    public NormalizedResponse normalize(NormalizedResponse raw, Mode routedMode) {
        Mode fallbackMode = routedMode == null ? Mode.INFO : routedMode;
        if (raw == null) {
            return empty(fallbackMode);
        }
        return NormalizedResponse.builder()
                .mode(raw.mode() == null ? fallbackMode : raw.mode())
                .summary(text(raw.summary()))
                .keyPoints(texts(raw.keyPoints()))
                .itemList(items(raw.itemList()))
                .nextStep(text(raw.nextStep()))
                .primaryPairing(pairing(raw.primaryPairing()))
                .alternativePairings(pairings(raw.alternativePairings()))
                .stops(stops(raw.stops()))
                .targetBottles(texts(raw.targetBottles()))
                .storeTargets(texts(raw.storeTargets()))
                .build();
    }

    /**
     * Builds a response from an untyped map such as parsed model output. Unknown keys are dropped and scalar
     * values are coerced into the list shapes the schema expects.
     */
    public NormalizedResponse fromRaw(Map<String, ?> raw, Mode routedMode) {
        if (raw == null) {
            return normalize((NormalizedResponse) null, routedMode);
        }
        NormalizedResponse draft = NormalizedResponse.builder()
                .mode(Mode.fromTag(asText(raw.get("mode"))).orElse(routedMode))
                .summary(asText(raw.get("summary")))
                .keyPoints(asTextList(raw.get("key_points")))
                .itemList(asItems(raw.get("item_list")))
                .nextStep(asText(raw.get("next_step")))
                .primaryPairing(asPairing(raw.get("primary_pairing")))
                .alternativePairings(asPairings(raw.get("alternative_pairings")))
                .stops(asStops(raw.get("stops")))
                .targetBottles(asTextList(raw.get("target_bottles")))
                .storeTargets(asTextList(raw.get("store_targets")))
                .build();
        return normalize(draft, routedMode);
    }

    private static NormalizedResponse empty(Mode mode) {
        return NormalizedResponse.builder()
                .mode(mode)
                .summary("")
                .keyPoints(List.of())
                .itemList(List.of())
                .nextStep("")
                .alternativePairings(List.of())
                .stops(List.of())
                .targetBottles(List.of())
                .storeTargets(List.of())
                .build();
    }

    private static Stop toStop(StoreRecord store) {
        String notes = text(store.notes());
        if (StringUtils.hasText(store.phone())) {
            notes = (notes + " Phone: " + store.phone().trim()).trim();
        }
        return new Stop(store.name(), store.address(), notes, store.lat(), store.lng());
    }

    // repair helpers: every one is idempotent

    private static String text(String value) {
        return value == null ? "" : value.trim();
    }

    private static List<String> texts(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(it -> !it.isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    private static List<LabeledItem> items(List<LabeledItem> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(item -> new LabeledItem(text(item.label()), text(item.value())))
                .filter(item -> !item.label().isEmpty() || !item.value().isEmpty())
                .collect(Collectors.toUnmodifiableList());
    }

    private static PairingDetail pairing(PairingDetail value) {
        if (value == null) {
            return null;
        }
        return PairingDetail.builder()
                .cigar(text(value.cigar()))
                .strength(text(value.strength()))
                .why(texts(value.why()))
                .pour(text(value.pour()))
                .qualityTag(text(value.qualityTag()))
                .build();
    }

    private static List<PairingDetail> pairings(List<PairingDetail> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(ResponseNormalizer::pairing)
                .collect(Collectors.toUnmodifiableList());
    }

    private static List<Stop> stops(List<Stop> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .filter(stop -> StringUtils.hasText(stop.name()))
                .map(stop -> new Stop(text(stop.name()), text(stop.address()), text(stop.notes()), stop.lat(), stop.lng()))
                .collect(Collectors.toUnmodifiableList());
    }

    // coercion helpers for untyped input

    private static String asText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                    .map(ResponseNormalizer::asText)
                    .filter(it -> !it.isEmpty())
                    .collect(Collectors.joining("; "));
        }
        if (value instanceof Map<?, ?> map) {
            return map.values().stream()
                    .map(ResponseNormalizer::asText)
                    .filter(it -> !it.isEmpty())
                    .collect(Collectors.joining(", "));
        }
        return value.toString().trim();
    }

    private static List<String> asTextList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                    .map(ResponseNormalizer::asText)
                    .filter(it -> !it.isEmpty())
                    .collect(Collectors.toList());
        }
        String single = asText(value);
        return single.isEmpty() ? List.of() : List.of(single);
    }

    private static List<LabeledItem> asItems(Object value) {
        if (value == null) {
            return List.of();
        }
        List<LabeledItem> items = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                items.add(asItem(element));
            }
        } else if (value instanceof Map<?, ?> map && !map.containsKey("label") && !map.containsKey("value")) {
            map.forEach((key, entry) -> items.add(new LabeledItem(asText(key), asText(entry))));
        } else {
            items.add(asItem(value));
        }
        return items;
    }

    private static LabeledItem asItem(Object element) {
        if (element instanceof Map<?, ?> map) {
            if (map.containsKey("label") || map.containsKey("value")) {
                return new LabeledItem(asText(map.get("label")), asText(map.get("value")));
            }
            if (map.size() == 1) {
                Map.Entry<?, ?> only = map.entrySet().iterator().next();
                return new LabeledItem(asText(only.getKey()), asText(only.getValue()));
            }
        }
        return new LabeledItem(DEFAULT_ITEM_LABEL, asText(element));
    }

    private static PairingDetail asPairing(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            return PairingDetail.builder()
                    .cigar(asText(map.get("cigar")))
                    .strength(asText(map.get("strength")))
                    .why(asTextList(map.get("why")))
                    .pour(asText(map.get("pour")))
                    .qualityTag(asText(map.get("quality_tag")))
                    .build();
        }
        String cigar = asText(value);
        return cigar.isEmpty() ? null : PairingDetail.builder().cigar(cigar).build();
    }

    private static List<PairingDetail> asPairings(Object value) {
        if (value == null) {
            return List.of();
        }
        Collection<?> elements = value instanceof Collection<?> collection ? collection : List.of(value);
        List<PairingDetail> pairings = new ArrayList<>();
        for (Object element : elements) {
            PairingDetail pairing = asPairing(element);
            if (pairing != null) {
                pairings.add(pairing);
            }
        }
        return pairings;
    }

    private static List<Stop> asStops(Object value) {
        if (value == null) {
            return List.of();
        }
        Collection<?> elements = value instanceof Collection<?> collection ? collection : List.of(value);
        List<Stop> stops = new ArrayList<>();
        for (Object element : elements) {
            if (element instanceof Map<?, ?> map) {
                stops.add(new Stop(asText(map.get("name")), asText(map.get("address")), asText(map.get("notes")),
                        asDouble(map.get("lat")), asDouble(map.get("lng"))));
            } else if (element != null) {
                stops.add(new Stop(asText(element), "", "", null, null));
            }
        }
        return stops;
    }

    private static Double asDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String string && StringUtils.hasText(string)) {
            try {
                return Double.parseDouble(string.trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }
}
