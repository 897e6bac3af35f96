package ai.foundrystack.backend.service;

/**
 * Text-completion primitive used by the agent chains.
 */
public interface ModelClient {

    /**
     * Sends a prompt to the model and returns the generated text.
     *
     * @param prompt full prompt text
     * @param temperature sampling temperature
     * @return generated text, empty when the provider produced none
     * @throws ai.foundrystack.backend.service.exception.ModelClientException on provider or transport errors
     */
    String complete(String prompt, double temperature);

    /**
     * @return short provider name, used as the model rate limiter key
     */
    String getProviderName();

    /**
     * Forgets any stored completion for the prompt, e.g. after its output turned out to be unusable.
     */
    default void invalidate(String prompt, double temperature) {
    }
}
