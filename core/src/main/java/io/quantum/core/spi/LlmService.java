package io.quantum.core.spi;

/** Text generation collaborator used by {@code q:llm}. */
public interface LlmService {

    String generate(String prompt, ModelConfig modelConfig);

    /**
     * Model selection and sampling options. {@code null} fields mean "use the service default".
     */
    record ModelConfig(String model, String system, Double temperature, Integer maxTokens) {

        public static final ModelConfig DEFAULT = new ModelConfig(null, null, null, null);
    }
}
