package io.github.drompincen.remedyguard.runtime.generation;

import io.github.drompincen.remedyguard.runtime.prompt.GenerationPrompt;

public interface GenerationClient {

    /**
     * Returns the model's recommendation text.
     *
     * @throws io.github.drompincen.remedyguard.protocol.error.GenerationException when the
     *         backend fails or answers with nothing usable
     */
    String generate(GenerationPrompt prompt);

    /**
     * Returns true if the backend currently answers. Used for status reporting only; the
     * gate always attempts the call.
     */
    default boolean isAvailable() { return true; }

    default String getProviderInfo() { return getClass().getSimpleName(); }
}
