package org.lime.caddie.web;

import org.lime.caddie.conversation.DialogueService;
import org.lime.caddie.response.NormalizedResponse;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

@RestController
@RequestMapping("/api")
public class DialogueController {

    static final int MAX_MESSAGE_LENGTH = 2000;
    private static final Pattern USER_ID = Pattern.compile("[A-Za-z0-9_.@-]{1,128}");

    private final DialogueService dialogueService;

    public DialogueController(DialogueService dialogueService) {
        this.dialogueService = dialogueService;
    }

    @PostMapping("/chat")
    public ChatReply chat(@RequestBody ChatRequest request) {
        String userId = StringUtils.hasText(request.userId())
                ? requireValidUserId(request.userId().trim())
                : "anon-" + UUID.randomUUID();
        String message = request.message() == null ? "" : request.message();
        if (message.length() > MAX_MESSAGE_LENGTH) {
            throw new IllegalArgumentException("Message is longer than " + MAX_MESSAGE_LENGTH + " characters");
        }
        NormalizedResponse response = dialogueService.handle(userId, message);
        return new ChatReply(userId, response);
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok", "service", "bourbon-caddie");
    }

    static String requireValidUserId(String userId) {
        if (!USER_ID.matcher(userId).matches()) {
            throw new IllegalArgumentException("Invalid user id");
        }
        return userId;
    }
}
