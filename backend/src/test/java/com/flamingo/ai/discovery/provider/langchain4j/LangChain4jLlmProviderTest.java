package com.flamingo.ai.discovery.provider.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.discovery.exception.LlmServiceException;
import com.flamingo.ai.discovery.service.generation.prompt.Prompt;
import com.flamingo.ai.discovery.service.generation.prompt.PromptSection;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
@DisplayName("LangChain4jLlmProvider Tests")
class LangChain4jLlmProviderTest {

  @Mock private ChatModel chatModel;
  @Mock private StreamingChatModel streamingChatModel;

  private LangChain4jLlmProvider llmProvider;

  private final Prompt prompt =
      new Prompt(
          "You are helpful.",
          List.of(
              new PromptSection(PromptSection.Kind.INSTRUCTIONS, "## Answer\nAnswer it."),
              new PromptSection(PromptSection.Kind.EXCERPT, "[S1:0] notes\nSome text")),
          List.of(),
          20,
          300);

  @BeforeEach
  void setUp() {
    llmProvider = new LangChain4jLlmProvider(chatModel, streamingChatModel);
  }

  private static ChatResponse response(String text) {
    return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
  }

  @Test
  @DisplayName("Should send system and user messages with sampling parameters")
  void shouldBuildChatRequest() {
    when(chatModel.chat(any(ChatRequest.class))).thenReturn(response("Answer"));

    String answer = llmProvider.complete(prompt, 0.3, 300);

    ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
    verify(chatModel).chat(captor.capture());
    ChatRequest request = captor.getValue();
    assertThat(answer).isEqualTo("Answer");
    assertThat(request.messages()).hasSize(2);
    assertThat(((SystemMessage) request.messages().get(0)).text()).isEqualTo("You are helpful.");
    assertThat(((UserMessage) request.messages().get(1)).singleText())
        .isEqualTo(prompt.userMessage());
    assertThat(request.temperature()).isEqualTo(0.3);
    assertThat(request.maxOutputTokens()).isEqualTo(300);
  }

  @Test
  @DisplayName("Should translate model exceptions on blocking calls")
  void shouldTranslateBlockingFailure() {
    when(chatModel.chat(any(ChatRequest.class)))
        .thenThrow(new NonRetriableException("invalid api key"));

    assertThatThrownBy(() -> llmProvider.complete(prompt, 0.3, 300))
        .isInstanceOf(LlmServiceException.class)
        .hasMessageContaining("invalid api key")
        .satisfies(e -> assertThat(((LlmServiceException) e).isTransient()).isFalse());
  }

  @Test
  @DisplayName("Should stream partial responses and complete")
  void shouldStreamPartialResponses() {
    doAnswer(
            invocation -> {
              StreamingChatResponseHandler handler = invocation.getArgument(1);
              handler.onPartialResponse("Hel");
              handler.onPartialResponse("lo");
              handler.onCompleteResponse(response("Hello"));
              return null;
            })
        .when(streamingChatModel)
        .chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));

    StepVerifier.create(llmProvider.stream(prompt, 0.7, 300))
        .expectNext("Hel", "lo")
        .verifyComplete();
  }

  @Test
  @DisplayName("Should surface streaming errors as transient when rate limited")
  void shouldTranslateStreamingError() {
    doAnswer(
            invocation -> {
              StreamingChatResponseHandler handler = invocation.getArgument(1);
              handler.onPartialResponse("Hel");
              handler.onError(new RateLimitException("slow down"));
              return null;
            })
        .when(streamingChatModel)
        .chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));

    StepVerifier.create(llmProvider.stream(prompt, 0.7, 300))
        .expectNext("Hel")
        .expectErrorSatisfies(
            error -> {
              assertThat(error).isInstanceOf(LlmServiceException.class);
              LlmServiceException llmError = (LlmServiceException) error;
              assertThat(llmError.isTransient()).isTrue();
              assertThat(llmError.isRateLimited()).isTrue();
            })
        .verify();
  }

  @Test
  @DisplayName("Should treat unclassified errors as transient")
  void shouldTreatUnknownErrorsAsTransient() {
    LlmServiceException translated =
        LangChain4jLlmProvider.translate(new RuntimeException(new IOException("reset")));

    assertThat(translated.isTransient()).isTrue();
    assertThat(translated.isRateLimited()).isFalse();
  }

  @Test
  @DisplayName("Should estimate four characters per token")
  void shouldCountTokens() {
    assertThat(llmProvider.countTokens("abcde")).isEqualTo(2);
    assertThat(llmProvider.countTokens("abcd")).isEqualTo(1);
    assertThat(llmProvider.countTokens(null)).isZero();
  }
}
