package org.lime.caddie.mode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.lime.caddie.ai.TopicAnswerService;
import org.lime.caddie.conversation.DialogueSession;
import org.lime.caddie.conversation.Mode;
import org.lime.caddie.response.LabeledItem;
import org.lime.caddie.response.ModeOutput;
import org.lime.caddie.response.NormalizedResponse;
import org.lime.caddie.response.ResponseNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Map;

@Component
public class InfoModeHandler {

    private static final Logger log = LoggerFactory.getLogger(InfoModeHandler.class);

    private final TopicAnswerService answerService;
    private final ResponseNormalizer normalizer;
    private final ObjectMapper objectMapper;

    public InfoModeHandler(TopicAnswerService answerService, ResponseNormalizer normalizer, ObjectMapper objectMapper) {
        this.answerService = answerService;
        this.normalizer = normalizer;
        this.objectMapper = objectMapper;
    }

    public ModeOutput.Info handle(String message, DialogueSession session) {
        String topic = session.contextText(DialogueSession.INFO_TOPIC);
        if (!StringUtils.hasText(topic)) {
            topic = message == null ? "" : message.trim();
        }
        String answer = answerService.generateAnswer(topic, session.contextText(DialogueSession.PREFERENCE_SUMMARY));
        Map<String, Object> parsed = parseJson(answer);
        if (parsed == null) {
            return ModeOutput.Info.builder()
                    .summary(answer)
                    .item(new LabeledItem("Topic", topic))
                    .build();
        }
        NormalizedResponse drafted = normalizer.fromRaw(parsed, Mode.INFO);
        return ModeOutput.Info.builder()
                .summary(drafted.summary())
                .keyPoints(drafted.keyPoints())
                .items(drafted.itemList())
                .nextStep(drafted.nextStep())
                .build();
    }

    private Map<String, Object> parseJson(String answer) {
        int start = answer.indexOf('{');
        int end = answer.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        try {
            return objectMapper.readValue(answer.substring(start, end + 1), new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException ex) {
            log.debug("[InfoModeHandler] Answer is not JSON, using it as prose: {}", ex.getOriginalMessage());
            return null;
        }
    }
}
