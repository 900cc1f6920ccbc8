package org.lime.caddie.profile;

import org.junit.jupiter.api.Test;
import org.lime.caddie.conversation.Intensity;
import org.lime.caddie.conversation.Mode;
import org.lime.caddie.memory.EntityCategory;
import org.lime.caddie.memory.TrackedEntity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(JpaPreferenceStore.class)
class JpaPreferenceStoreTest {

    @Autowired
    private JpaPreferenceStore store;

    @Autowired
    private InteractionRecordRepository interactions;

    @Test
    void unknownUserHasEmptyPreferences() {
        PreferenceRecord record = store.getUserPreferences("nobody");

        assertThat(record.isEmpty()).isTrue();
        assertThat(record.summary()).isEmpty();
    }

    @Test
    void strengthAndPriceAreUpsertedIndependently() {
        store.updatePreferences("u1", Intensity.FULL, null);
        store.updatePreferences("u1", null, "premium");

        PreferenceRecord record = store.getUserPreferences("u1");
        assertThat(record.cigarStrength()).isEqualTo("full");
        assertThat(record.pricePreference()).isEqualTo("premium");
        assertThat(record.summary()).contains("prefers full cigars").contains("shops premium price points");
    }

    @Test
    void nothingToSaveCreatesNoRow() {
        store.updatePreferences("u2", null, " ");

        assertThat(store.getUserPreferences("u2").isEmpty()).isTrue();
    }

    @Test
    void repeatedMentionsBecomeAFavorite() {
        TrackedEntity weller = entity(EntityCategory.BOURBON, "Weller");
        store.recordInteraction("u1", weller, Mode.HUNT);
        store.recordInteraction("u1", weller, Mode.PAIRING);
        assertThat(store.getUserPreferences("u1").favoriteBourbons()).isEmpty();

        store.recordInteraction("u1", weller, Mode.INFO);

        assertThat(store.getUserPreferences("u1").favoriteBourbons()).containsExactly("Weller");
        assertThat(store.getUserPreferences("u1").favoriteCigars()).isEmpty();
    }

    @Test
    void favoritesAreCountedPerUserAndCategory() {
        store.recordInteraction("u1", entity(EntityCategory.CIGAR, "Padron 1964"), Mode.PAIRING);
        store.recordInteraction("u1", entity(EntityCategory.CIGAR, "Padron 1964"), Mode.PAIRING);
        store.recordInteraction("u2", entity(EntityCategory.CIGAR, "Padron 1964"), Mode.PAIRING);

        assertThat(store.getUserPreferences("u1").favoriteCigars()).isEmpty();

        store.recordInteraction("u1", entity(EntityCategory.CIGAR, "Padron 1964"), Mode.INFO);
        assertThat(store.getUserPreferences("u1").favoriteCigars()).containsExactly("Padron 1964");
        assertThat(store.getUserPreferences("u2").favoriteCigars()).isEmpty();
    }

    @Test
    void historyIsNewestFirstAndLimited() {
        store.recordInteraction("u1", entity(EntityCategory.BOURBON, "Weller"), Mode.HUNT);
        store.recordInteraction("u1", entity(EntityCategory.CIGAR, "Oliva"), Mode.PAIRING);
        store.recordInteraction("u1", entity(EntityCategory.BOURBON, "Blanton's"), Mode.HUNT);

        List<HistoryEntry> history = store.recentHistory("u1", 2);

        assertThat(history).extracting(HistoryEntry::entity).containsExactly("Blanton's", "Oliva");
        assertThat(history.get(1).category()).isEqualTo("cigar");
        assertThat(history.get(1).mode()).isEqualTo("pairing");
    }

    @Test
    void forgetRemovesEverythingForThatUserOnly() {
        store.updatePreferences("u1", Intensity.MILD, "budget");
        store.recordInteraction("u1", entity(EntityCategory.BOURBON, "Weller"), Mode.HUNT);
        store.recordInteraction("u2", entity(EntityCategory.BOURBON, "Weller"), Mode.HUNT);

        assertThat(store.forget("u1")).isTrue();

        assertThat(store.getUserPreferences("u1").isEmpty()).isTrue();
        assertThat(store.recentHistory("u1", 10)).isEmpty();
        assertThat(store.recentHistory("u2", 10)).hasSize(1);
        assertThat(interactions.count(InteractionSpec.userEquals("u2"))).isEqualTo(1);
        assertThat(store.forget("u1")).isFalse();
    }

    @Test
    void blankEntityIsIgnored() {
        store.recordInteraction("u1", new TrackedEntity(EntityCategory.BOURBON, " ", Map.of(), 1), Mode.INFO);
        store.recordInteraction(" ", entity(EntityCategory.BOURBON, "Weller"), Mode.INFO);

        assertThat(interactions.count()).isZero();
    }

    private static TrackedEntity entity(EntityCategory category, String name) {
        return new TrackedEntity(category, name, Map.of(), 1);
    }
}
