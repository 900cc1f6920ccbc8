package org.lime.caddie.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Map;

@Service
public class TopicAnswerService {

    private static final Logger log = LoggerFactory.getLogger(TopicAnswerService.class);

    private final ChatClient chatClient;

    private static final PromptTemplate ANSWER_TEMPLATE = new PromptTemplate("""
        You are a bourbon and cigar caddie: a knowledgeable friend at the bar, not a salesperson.

        Topic:
        {topic}

        KnownPreferences:
        {preferences}

        Guidelines:
        - Answer the topic directly in plain, confident language.
        - Keep the summary to one or two sentences.
        - Give three to five short key points a regular drinker can act on.
        - Never invent store names, prices or release dates.
        - If the topic is about pairing, name the pairing in the key points.

        Return only a JSON object with these fields:
        summary (string), key_points (array of strings), item_list (array of objects with label and value),
        next_step (string with one concrete suggestion).
        """);

    public TopicAnswerService(ChatClient.Builder builder) {
        this.chatClient = builder.build();
    }

    public String generateAnswer(String topicPrompt) {
        return generateAnswer(topicPrompt, null);
    }

    public String generateAnswer(String topicPrompt, String preferenceSummary) {
        if (!StringUtils.hasText(topicPrompt)) {
            throw new TextGenerationException("No topic to answer");
        }
        Map<String, Object> vars = Map.of(
                "topic", topicPrompt.trim(),
                "preferences", StringUtils.hasText(preferenceSummary) ? preferenceSummary : "none"
        );
        String content;
        try {
            content = chatClient.prompt(ANSWER_TEMPLATE.create(vars))
                    .call()
                    .content();
        } catch (RuntimeException ex) {
            log.warn("[TopicAnswerService] Generation failed for topic '{}': {}", topicPrompt, ex.toString());
            throw new TextGenerationException("Answer generation failed", ex);
        }
        if (!StringUtils.hasText(content) || content.trim().startsWith("Error:")) {
            throw new TextGenerationException("Language model returned no usable answer");
        }
        return content.trim();
    }
}
