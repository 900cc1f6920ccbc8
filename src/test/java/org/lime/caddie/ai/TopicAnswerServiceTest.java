package org.lime.caddie.ai;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Answers;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.Prompt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TopicAnswerServiceTest {

    private ChatClient chatClient;
    private TopicAnswerService service;

    @BeforeEach
    void setUp() {
        chatClient = mock(ChatClient.class, Answers.RETURNS_DEEP_STUBS);
        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        when(builder.build()).thenReturn(chatClient);
        service = new TopicAnswerService(builder);
    }

    @Test
    void returnsTrimmedModelText() {
        when(chatClient.prompt(any(Prompt.class)).call().content()).thenReturn("  {\"summary\":\"Wheat softens the palate.\"}\n");

        assertThat(service.generateAnswer("what is a wheater?", "prefers mild cigars"))
                .isEqualTo("{\"summary\":\"Wheat softens the palate.\"}");
    }

    @Test
    void blankOutputIsAFailure() {
        when(chatClient.prompt(any(Prompt.class)).call().content()).thenReturn(" ");

        assertThatThrownBy(() -> service.generateAnswer("what is a wheater?")).isInstanceOf(TextGenerationException.class);
    }

    @Test
    void errorPrefixedOutputIsAFailure() {
        when(chatClient.prompt(any(Prompt.class)).call().content()).thenReturn("Error: rate limited");

        assertThatThrownBy(() -> service.generateAnswer("what is a wheater?")).isInstanceOf(TextGenerationException.class);
    }

    @Test
    void clientExceptionIsWrapped() {
        when(chatClient.prompt(any(Prompt.class)).call().content()).thenThrow(new IllegalStateException("401"));

        assertThatThrownBy(() -> service.generateAnswer("what is a wheater?"))
                .isInstanceOf(TextGenerationException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void blankTopicIsRejectedBeforeCallingTheModel() {
        assertThatThrownBy(() -> service.generateAnswer("  ")).isInstanceOf(TextGenerationException.class);
    }
}
