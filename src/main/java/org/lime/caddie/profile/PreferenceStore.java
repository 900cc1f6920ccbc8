package org.lime.caddie.profile;

import org.lime.caddie.conversation.Intensity;
import org.lime.caddie.conversation.Mode;
import org.lime.caddie.memory.TrackedEntity;

import java.util.List;

public interface PreferenceStore {

    PreferenceRecord getUserPreferences(String userId);

    void recordInteraction(String userId, TrackedEntity entity, Mode mode);

    void updatePreferences(String userId, Intensity cigarStrength, String pricePreference);

    List<HistoryEntry> recentHistory(String userId, int limit);

    boolean forget(String userId);
}
