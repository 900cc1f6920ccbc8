package org.lime.caddie.ai;

import org.junit.jupiter.api.Test;
import org.lime.caddie.conversation.Intensity;

import static org.assertj.core.api.Assertions.assertThat;

class SignalExtractionServiceTest {

    private final SignalExtractionService extractor = new SignalExtractionService();

    @Test
    void postalCodeWinsAsArea() {
        TurnSignals signals = extractor.extract("30344 + Weller");

        assertThat(signals.getPostalCode()).isEqualTo("30344");
        assertThat(signals.getAreaHint()).isEqualTo("30344");
        assertThat(signals.getBottle()).isEqualTo("Weller");
        assertThat(signals.isStoreIntent()).isFalse();
    }

    @Test
    void cityAndStateAreKeptTogether() {
        TurnSignals signals = extractor.extract("Dallas, TX + best allocation shops");

        assertThat(signals.getAreaHint()).isEqualTo("Dallas, TX");
        assertThat(signals.isStoreIntent()).isTrue();
        assertThat(signals.getBottle()).isNull();
    }

    @Test
    void placeAfterPrepositionIsAnArea() {
        assertThat(extractor.extract("find Blanton's near Lexington for me").getAreaHint()).isEqualTo("Lexington");
        assertThat(extractor.extract("any drops in Memphis?").getAreaHint()).isEqualTo("Memphis");
    }

    @Test
    void commonPhrasesAreNotPlaces() {
        assertThat(extractor.extract("is Weller in stock").getAreaHint()).isNull();
        assertThat(extractor.extract("what should I have in mind").getAreaHint()).isNull();
        assertThat(extractor.extract("best shops near me").getAreaHint()).isNull();
    }

    @Test
    void knownAreaWithoutPreposition() {
        assertThat(extractor.extract("nashville allocation shops").getAreaHint()).isEqualTo("nashville");
    }

    @Test
    void bottlesAndCigarsAreNamedCanonically() {
        TurnSignals signals = extractor.extract("would a padron go with eagle rare?");

        assertThat(signals.getCigar()).isEqualTo("Padron");
        assertThat(signals.getBottle()).isEqualTo("Eagle Rare");
        assertThat(signals.isMentionsCigars()).isTrue();
        assertThat(signals.hasPairingSubject()).isTrue();
    }

    @Test
    void spiritWordCountsAsPairingSubject() {
        TurnSignals signals = extractor.extract("pair a cigar with bourbon");

        assertThat(signals.getSpirit()).isEqualTo("bourbon");
        assertThat(signals.getBottle()).isNull();
        assertThat(signals.hasPairingSubject()).isTrue();
    }

    @Test
    void intensityWords() {
        assertThat(extractor.extractIntensity("something fuller")).contains(Intensity.FULL);
        assertThat(extractor.extractIntensity("go milder")).contains(Intensity.MILD);
        assertThat(extractor.extractIntensity("medium please")).contains(Intensity.MEDIUM);
        assertThat(extractor.extractIntensity("surprise me")).isEmpty();
    }

    @Test
    void fullBeatsMildWhenBothAppear() {
        assertThat(extractor.extractIntensity("not mild, something bold")).contains(Intensity.FULL);
    }

    @Test
    void pricePreference() {
        assertThat(extractor.extract("a budget pour").getPricePreference()).isEqualTo("budget");
        assertThat(extractor.extract("time to splurge").getPricePreference()).isEqualTo("premium");
        assertThat(extractor.extract("something mid-range").getPricePreference()).isEqualTo("mid");
        assertThat(extractor.extract("anything").getPricePreference()).isNull();
    }

    @Test
    void cigarShoppingIsDetected() {
        TurnSignals signals = extractor.extract("find cigar shops in Chicago");

        assertThat(signals.isMentionsCigars()).isTrue();
        assertThat(signals.isStoreIntent()).isTrue();
        assertThat(signals.getAreaHint()).isEqualTo("Chicago");
    }

    @Test
    void blankMessageHasNoSignals() {
        TurnSignals signals = extractor.extract("   ");

        assertThat(signals.getAreaHint()).isNull();
        assertThat(signals.hasPairingSubject()).isFalse();
    }

    @Test
    void wordMatchingRespectsBoundaries() {
        assertThat(SignalExtractionService.containsWord("restore the shelf", "store")).isFalse();
        assertThat(SignalExtractionService.containsWord("a store nearby", "store")).isTrue();
    }
}
