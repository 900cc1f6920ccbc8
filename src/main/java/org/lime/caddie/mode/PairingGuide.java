package org.lime.caddie.mode;

import org.lime.caddie.conversation.Intensity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

final class PairingGuide {

    record Suggestion(String name, String pour, String qualityTag, List<String> why) {
    }

    private static final Map<Intensity, Suggestion> CIGAR_FOR_POUR = new EnumMap<>(Intensity.class);
    private static final Map<Intensity, Suggestion> POUR_FOR_CIGAR = new EnumMap<>(Intensity.class);

    static {
        CIGAR_FOR_POUR.put(Intensity.MILD, new Suggestion("Connecticut Shade Robusto", "Neat", "easy",
                List.of("Creamy wrapper will not bury a softer wheated pour", "Short smoke that fits one glass")));
        CIGAR_FOR_POUR.put(Intensity.MEDIUM, new Suggestion("Nicaraguan Toro", "Neat or one large cube", "balanced",
                List.of("Cedar and light pepper meet caramel and oak", "Holds up without taking over")));
        CIGAR_FOR_POUR.put(Intensity.FULL, new Suggestion("Maduro Churchill", "Neat, barrel proof if you have it", "bold",
                List.of("Dark chocolate and espresso match high-proof heat", "Long smoke for a slow second pour")));

        POUR_FOR_CIGAR.put(Intensity.MILD, new Suggestion("Wheated bourbon around 90 proof", "Neat", "easy",
                List.of("Soft sweetness keeps a lighter smoke in front", "Low proof avoids numbing the palate")));
        POUR_FOR_CIGAR.put(Intensity.MEDIUM, new Suggestion("High-rye bourbon around 100 proof", "Neat or a few drops of water", "balanced",
                List.of("Rye spice mirrors the cigar's pepper", "Enough proof to cut through the smoke")));
        POUR_FOR_CIGAR.put(Intensity.FULL, new Suggestion("Barrel proof bourbon", "Neat, add water to taste", "bold",
                List.of("Heavy oak and proof stand up to a strong smoke", "Water opens it up as the cigar builds")));
    }

    private PairingGuide() {
    }

    static Suggestion cigarFor(Intensity intensity) {
        return CIGAR_FOR_POUR.get(intensity);
    }

    static Suggestion pourFor(Intensity intensity) {
        return POUR_FOR_CIGAR.get(intensity);
    }
}
