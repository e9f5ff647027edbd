package com.flamingo.ai.discovery.provider.langchain4j;

import com.flamingo.ai.discovery.exception.LlmServiceException;
import com.flamingo.ai.discovery.provider.LlmProvider;
import com.flamingo.ai.discovery.service.generation.prompt.Prompt;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/** {@link LlmProvider} on top of LangChain4j chat models. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LangChain4jLlmProvider implements LlmProvider {

  private static final int CHARS_PER_TOKEN = 4;

  private final ChatModel chatModel;
  private final StreamingChatModel streamingChatModel;

  @Override
  public String complete(Prompt prompt, double temperature, int maxTokens) {
    try {
      ChatResponse response = chatModel.chat(toRequest(prompt, temperature, maxTokens));
      if (response == null || response.aiMessage() == null) {
        return "";
      }
      return response.aiMessage().text() == null ? "" : response.aiMessage().text();
    } catch (RuntimeException e) {
      throw translate(e);
    }
  }

  @Override
  public Flux<String> stream(Prompt prompt, double temperature, int maxTokens) {
    return Flux.defer(
        () -> {
          Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
          try {
            streamingChatModel.chat(
                toRequest(prompt, temperature, maxTokens),
                new StreamingChatResponseHandler() {
                  @Override
                  public void onPartialResponse(String partialResponse) {
                    var result = sink.tryEmitNext(partialResponse);
                    if (result.isFailure()) {
                      log.trace("Dropped partial response: {}", result);
                    }
                  }

                  @Override
                  public void onCompleteResponse(ChatResponse completeResponse) {
                    sink.tryEmitComplete();
                  }

                  @Override
                  public void onError(Throwable error) {
                    sink.tryEmitError(translate(error));
                  }
                });
          } catch (RuntimeException e) {
            sink.tryEmitError(translate(e));
          }
          return sink.asFlux();
        });
  }

  @Override
  public int countTokens(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
  }

  private static ChatRequest toRequest(Prompt prompt, double temperature, int maxTokens) {
    List<ChatMessage> messages = new ArrayList<>();
    if (prompt.system() != null && !prompt.system().isBlank()) {
      messages.add(SystemMessage.from(prompt.system()));
    }
    messages.add(UserMessage.from(prompt.userMessage()));
    return ChatRequest.builder()
        .messages(messages)
        .temperature(temperature)
        .maxOutputTokens(maxTokens)
        .build();
  }

  static LlmServiceException translate(Throwable error) {
    if (error instanceof LlmServiceException llmException) {
      return llmException;
    }
    if (error instanceof RateLimitException) {
      return new LlmServiceException(
          "LLM rate limit hit: " + error.getMessage(), true, true, error);
    }
    if (error instanceof RetriableException) {
      return new LlmServiceException(error.getMessage(), true, error);
    }
    if (error instanceof NonRetriableException) {
      return new LlmServiceException(error.getMessage(), false, error);
    }
    // Network and unclassified errors.
    return new LlmServiceException(
        error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage(),
        true,
        error);
  }
}
