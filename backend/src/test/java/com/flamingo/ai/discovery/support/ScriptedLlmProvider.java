package com.flamingo.ai.discovery.support;

import com.flamingo.ai.discovery.provider.LlmProvider;
import com.flamingo.ai.discovery.service.generation.prompt.Prompt;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import reactor.core.publisher.Flux;

/**
 * LLM provider answering through a test-supplied function. Tokens are counted as one per four
 * characters, rounded up.
 */
public class ScriptedLlmProvider implements LlmProvider {

  private volatile Function<Prompt, Flux<String>> responder = prompt -> Flux.just("");
  private final List<Prompt> prompts = new CopyOnWriteArrayList<>();

  public static ScriptedLlmProvider answering(String answer) {
    ScriptedLlmProvider provider = new ScriptedLlmProvider();
    provider.respondWith(prompt -> Flux.just(answer));
    return provider;
  }

  public void respondWith(Function<Prompt, Flux<String>> responder) {
    this.responder = responder;
  }

  @Override
  public String complete(Prompt prompt, double temperature, int maxTokens) {
    prompts.add(prompt);
    return String.join("", responder.apply(prompt).collectList().block());
  }

  @Override
  public Flux<String> stream(Prompt prompt, double temperature, int maxTokens) {
    return Flux.defer(
        () -> {
          prompts.add(prompt);
          return responder.apply(prompt);
        });
  }

  @Override
  public int countTokens(String text) {
    return text == null ? 0 : (text.length() + 3) / 4;
  }

  public List<Prompt> prompts() {
    return prompts;
  }

  public Prompt lastPrompt() {
    return prompts.get(prompts.size() - 1);
  }
}
