package com.docsum.llm.generation;

import java.util.concurrent.CompletableFuture;

/**
 * Submit a prompt, asynchronously receive generated text.
 *
 * <p>The returned future completes exceptionally with a
 * {@link com.docsum.llm.exception.GenerationException} when the call fails. Cancelling it
 * abandons the call.
 */
@FunctionalInterface
public interface Generator {

    CompletableFuture<String> generate(String systemPrompt, String userPrompt);
}
