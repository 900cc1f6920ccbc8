package org.lime.caddie.web;

import org.lime.caddie.conversation.DialogueSession;
import org.lime.caddie.conversation.DialogueSessionStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/sessions")
public class SessionDebugController {

    private final DialogueSessionStore sessionStore;

    public SessionDebugController(DialogueSessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @GetMapping("/{userId}")
    public ResponseEntity<Map<String, Object>> session(@PathVariable String userId) {
        return sessionStore.withExistingSession(DialogueController.requireValidUserId(userId), DialogueSession::snapshot)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
