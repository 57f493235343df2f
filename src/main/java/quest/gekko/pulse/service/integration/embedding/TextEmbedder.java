package quest.gekko.pulse.service.integration.embedding;

public interface TextEmbedder {

    /** Embedding of {@code text}; an empty array when the provider is unavailable. */
    float[] embed(String text);
}
