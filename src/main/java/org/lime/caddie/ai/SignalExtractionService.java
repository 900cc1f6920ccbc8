package org.lime.caddie.ai;

import org.lime.caddie.conversation.Intensity;
import org.lime.caddie.geo.PostalCodes;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class SignalExtractionService {

    private static final Pattern CITY_STATE = Pattern.compile("([A-Z][A-Za-z.'-]*(?:\\s+[A-Z][A-Za-z.'-]*)*),\\s*([A-Z]{2})\\b");
    private static final Pattern PLACE_AFTER_PREPOSITION = Pattern.compile(
            "\\b(?:in|near|around)\\s+([a-z][a-z .'-]*?)(?=\\s*(?:$|[?.!,+]|\\s(?:for|to|with|and|that|this)\\b))",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern FULL_WORDS = Pattern.compile("\\b(full|fuller|strong|stronger|bold|bolder|heavy)\\b");
    private static final Pattern MILD_WORDS = Pattern.compile("\\b(mild|milder|light|lighter|smooth|smoother|gentle)\\b");
    private static final Pattern MEDIUM_WORDS = Pattern.compile("\\b(medium|balanced|middle)\\b");

    private static final String[] NOT_A_PLACE_PREFIXES = {
            "me", "my ", "the ", "a ", "an ", "stock", "general", "particular", "mind", "town"
    };
    private static final String[] KNOWN_AREAS = {
            "louisville", "lexington", "nashville", "memphis", "dallas", "fort worth", "houston", "austin",
            "atlanta", "chicago", "denver", "philadelphia", "new york", "nyc", "miami", "los angeles"
    };
    private static final String[] SPIRITS = {
            "bourbon", "rye", "scotch", "whiskey", "whisky", "tequila", "rum", "cognac"
    };
    private static final String[] STORE_PHRASES = {
            "allocation shops", "allocation stores", "best shops", "best stores", "liquor store", "liquor stores",
            "shops", "stores", "store", "shop", "retailers"
    };
    private static final String[] CIGAR_SHOPPING_WORDS = {
            "cigar", "cigars", "smoke shop", "humidor", "tobacconist", "tobacco"
    };
    private static final String[] BUDGET_WORDS = {"budget", "cheap", "affordable", "inexpensive", "value"};
    private static final String[] PREMIUM_WORDS = {"premium", "high-end", "high end", "expensive", "splurge"};
    private static final String[] MID_WORDS = {"mid-range", "mid range", "moderate", "mid-priced"};

    private static final Map<String, String> BOTTLE_MARKERS = new LinkedHashMap<>();
    private static final Map<String, String> CIGAR_MARKERS = new LinkedHashMap<>();

    static {
        BOTTLE_MARKERS.put("van winkle", "Pappy Van Winkle");
        BOTTLE_MARKERS.put("pappy", "Pappy Van Winkle");
        BOTTLE_MARKERS.put("weller", "Weller");
        BOTTLE_MARKERS.put("blanton", "Blanton's");
        BOTTLE_MARKERS.put("stagg", "Stagg");
        BOTTLE_MARKERS.put("e.h. taylor", "E.H. Taylor");
        BOTTLE_MARKERS.put("eh taylor", "E.H. Taylor");
        BOTTLE_MARKERS.put("taylor", "E.H. Taylor");
        BOTTLE_MARKERS.put("eagle rare", "Eagle Rare");
        BOTTLE_MARKERS.put("four roses", "Four Roses");
        BOTTLE_MARKERS.put("buffalo trace", "Buffalo Trace");
        BOTTLE_MARKERS.put("elijah craig", "Elijah Craig");
        BOTTLE_MARKERS.put("booker", "Booker's");
        BOTTLE_MARKERS.put("old forester", "Old Forester");
        BOTTLE_MARKERS.put("michter", "Michter's");
        BOTTLE_MARKERS.put("knob creek", "Knob Creek");
        BOTTLE_MARKERS.put("woodford", "Woodford Reserve");
        BOTTLE_MARKERS.put("maker's mark", "Maker's Mark");
        BOTTLE_MARKERS.put("makers mark", "Maker's Mark");

        CIGAR_MARKERS.put("padron", "Padron");
        CIGAR_MARKERS.put("arturo fuente", "Arturo Fuente");
        CIGAR_MARKERS.put("opus x", "Fuente OpusX");
        CIGAR_MARKERS.put("opusx", "Fuente OpusX");
        CIGAR_MARKERS.put("fuente", "Arturo Fuente");
        CIGAR_MARKERS.put("oliva", "Oliva");
        CIGAR_MARKERS.put("my father", "My Father");
        CIGAR_MARKERS.put("liga privada", "Liga Privada");
        CIGAR_MARKERS.put("davidoff", "Davidoff");
        CIGAR_MARKERS.put("romeo y julieta", "Romeo y Julieta");
        CIGAR_MARKERS.put("montecristo", "Montecristo");
        CIGAR_MARKERS.put("cohiba", "Cohiba");
        CIGAR_MARKERS.put("rocky patel", "Rocky Patel");
        CIGAR_MARKERS.put("ashton", "Ashton");
        CIGAR_MARKERS.put("perdomo", "Perdomo");
    }

    public TurnSignals extract(String message) {
        TurnSignals signals = new TurnSignals();
        if (!StringUtils.hasText(message)) {
            return signals;
        }
        String text = message.trim();
        String lower = text.toLowerCase(Locale.ROOT);

        PostalCodes.find(text).ifPresent(code -> {
            signals.setPostalCode(code);
            signals.setAreaHint(code);
        });
        if (signals.getAreaHint() == null) {
            signals.setAreaHint(extractArea(text, lower).orElse(null));
        }

        signals.setBottle(firstMarker(lower, BOTTLE_MARKERS));
        signals.setCigar(firstMarker(lower, CIGAR_MARKERS));
        for (String spirit : SPIRITS) {
            if (containsWord(lower, spirit)) {
                signals.setSpirit(spirit);
                break;
            }
        }
        signals.setIntensity(extractIntensity(lower).orElse(null));
        signals.setPricePreference(extractPricePreference(lower));
        signals.setStoreIntent(containsAnyWord(lower, STORE_PHRASES));
        signals.setMentionsCigars(signals.getCigar() != null || containsAnyWord(lower, CIGAR_SHOPPING_WORDS));
        return signals;
    }

    public Optional<Intensity> extractIntensity(String lower) {
        if (FULL_WORDS.matcher(lower).find()) {
            return Optional.of(Intensity.FULL);
        }
        if (MILD_WORDS.matcher(lower).find()) {
            return Optional.of(Intensity.MILD);
        }
        if (MEDIUM_WORDS.matcher(lower).find()) {
            return Optional.of(Intensity.MEDIUM);
        }
        return Optional.empty();
    }

    private static Optional<String> extractArea(String text, String lower) {
        Matcher cityState = CITY_STATE.matcher(text);
        if (cityState.find()) {
            return Optional.of(cityState.group(1).trim() + ", " + cityState.group(2));
        }
        Matcher preposition = PLACE_AFTER_PREPOSITION.matcher(text);
        while (preposition.find()) {
            String candidate = preposition.group(1).trim();
            if (!candidate.isEmpty() && !startsWithAny(candidate.toLowerCase(Locale.ROOT), NOT_A_PLACE_PREFIXES)) {
                return Optional.of(candidate);
            }
        }
        for (String area : KNOWN_AREAS) {
            if (containsWord(lower, area)) {
                return Optional.of(area);
            }
        }
        return Optional.empty();
    }

    private static String extractPricePreference(String lower) {
        if (containsAnyWord(lower, BUDGET_WORDS)) {
            return "budget";
        }
        if (containsAnyWord(lower, PREMIUM_WORDS)) {
            return "premium";
        }
        if (containsAnyWord(lower, MID_WORDS)) {
            return "mid";
        }
        return null;
    }

    private static String firstMarker(String lower, Map<String, String> markers) {
        for (Map.Entry<String, String> marker : markers.entrySet()) {
            if (lower.contains(marker.getKey())) {
                return marker.getValue();
            }
        }
        return null;
    }

    private static boolean startsWithAny(String text, String[] prefixes) {
        for (String prefix : prefixes) {
            if (text.equals(prefix.trim()) || (prefix.endsWith(" ") && text.startsWith(prefix))) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAnyWord(String lower, String[] words) {
        for (String word : words) {
            if (containsWord(lower, word)) {
                return true;
            }
        }
        return false;
    }

    static boolean containsWord(String lower, String word) {
        return Pattern.compile("(?<![\\w])" + Pattern.quote(word) + "(?![\\w])").matcher(lower).find();
    }
}
