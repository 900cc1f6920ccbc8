package org.lime.caddie.web;

import org.lime.caddie.conversation.DialogueSessionStore;
import org.lime.caddie.profile.PreferenceStore;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/users/{userId}/profile")
public class ProfileController {

    private static final int HISTORY_LIMIT = 10;

    private final PreferenceStore preferenceStore;
    private final DialogueSessionStore sessionStore;

    public ProfileController(PreferenceStore preferenceStore, DialogueSessionStore sessionStore) {
        this.preferenceStore = preferenceStore;
        this.sessionStore = sessionStore;
    }

    @GetMapping
    public Map<String, Object> profile(@PathVariable String userId) {
        String id = DialogueController.requireValidUserId(userId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", id);
        body.put("preferences", preferenceStore.getUserPreferences(id));
        body.put("recent_history", preferenceStore.recentHistory(id, HISTORY_LIMIT));
        return body;
    }

    @DeleteMapping
    public Map<String, Object> forget(@PathVariable String userId) {
        String id = DialogueController.requireValidUserId(userId);
        boolean removedProfile = preferenceStore.forget(id);
        boolean removedSession = sessionStore.evict(id);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user_id", id);
        body.put("status", "deleted");
        body.put("had_data", removedProfile || removedSession);
        return body;
    }
}
