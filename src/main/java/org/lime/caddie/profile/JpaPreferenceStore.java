package org.lime.caddie.profile;

import org.lime.caddie.conversation.Intensity;
import org.lime.caddie.conversation.Mode;
import org.lime.caddie.memory.EntityCategory;
import org.lime.caddie.memory.TrackedEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class JpaPreferenceStore implements PreferenceStore {

    private static final Logger log = LoggerFactory.getLogger(JpaPreferenceStore.class);
    static final int FAVORITE_THRESHOLD = 3;

    private final UserPreferenceRepository preferences;
    private final InteractionRecordRepository interactions;

    public JpaPreferenceStore(UserPreferenceRepository preferences, InteractionRecordRepository interactions) {
        this.preferences = preferences;
        this.interactions = interactions;
    }

    @Override
    @Transactional(readOnly = true)
    public PreferenceRecord getUserPreferences(String userId) {
        return preferences.findById(userId)
                .map(JpaPreferenceStore::toRecord)
                .orElseGet(() -> PreferenceRecord.empty(userId));
    }

    @Override
    @Transactional
    public void recordInteraction(String userId, TrackedEntity entity, Mode mode) {
        if (!StringUtils.hasText(userId) || entity == null || !StringUtils.hasText(entity.name())) {
            return;
        }
        interactions.save(InteractionRecord.builder()
                .userId(userId)
                .entityName(entity.name())
                .category(entity.category())
                .modeTag(mode == null ? null : mode.tag())
                .recordedAt(Instant.now())
                .build());
        long mentions = interactions.count(InteractionSpec.userEquals(userId)
                .and(InteractionSpec.entityEquals(entity.name()))
                .and(InteractionSpec.categoryEquals(entity.category())));
        if (mentions >= FAVORITE_THRESHOLD) {
            UserPreference preference = loadOrCreate(userId);
            boolean added = entity.category() == EntityCategory.CIGAR
                    ? preference.getFavoriteCigars().add(entity.name())
                    : preference.getFavoriteBourbons().add(entity.name());
            if (added) {
                preference.setUpdatedAt(Instant.now());
                preferences.save(preference);
                log.info("[JpaPreferenceStore] '{}' promoted to favorite for user {}", entity.name(), userId);
            }
        }
    }

    @Override
    @Transactional
    public void updatePreferences(String userId, Intensity cigarStrength, String pricePreference) {
        if (!StringUtils.hasText(userId) || (cigarStrength == null && !StringUtils.hasText(pricePreference))) {
            return;
        }
        UserPreference preference = loadOrCreate(userId);
        if (cigarStrength != null) {
            preference.setCigarStrength(cigarStrength.label());
        }
        if (StringUtils.hasText(pricePreference)) {
            preference.setPricePreference(pricePreference);
        }
        preference.setUpdatedAt(Instant.now());
        preferences.save(preference);
    }

    @Override
    @Transactional(readOnly = true)
    public List<HistoryEntry> recentHistory(String userId, int limit) {
        List<HistoryEntry> history = new ArrayList<>();
        for (InteractionRecord record : interactions.findTop20ByUserIdOrderByRecordedAtDescIdDesc(userId)) {
            if (history.size() >= limit) {
                break;
            }
            history.add(new HistoryEntry(
                    record.getEntityName(),
                    record.getCategory() == null ? null : record.getCategory().key(),
                    record.getModeTag(),
                    record.getRecordedAt()));
        }
        return history;
    }

    @Override
    @Transactional
    public boolean forget(String userId) {
        long removedInteractions = interactions.deleteByUserId(userId);
        boolean hadPreferences = preferences.existsById(userId);
        if (hadPreferences) {
            preferences.deleteById(userId);
        }
        log.info("[JpaPreferenceStore] Forgot user {} ({} interactions)", userId, removedInteractions);
        return hadPreferences || removedInteractions > 0;
    }

    private UserPreference loadOrCreate(String userId) {
        return preferences.findById(userId)
                .orElseGet(() -> UserPreference.builder().userId(userId).build());
    }

    private static PreferenceRecord toRecord(UserPreference preference) {
        return new PreferenceRecord(
                preference.getUserId(),
                preference.getCigarStrength(),
                preference.getPricePreference(),
                new ArrayList<>(preference.getFavoriteBourbons()),
                new ArrayList<>(preference.getFavoriteCigars())
        );
    }
}
