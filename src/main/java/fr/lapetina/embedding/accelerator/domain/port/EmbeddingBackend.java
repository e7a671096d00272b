package fr.lapetina.embedding.accelerator.domain.port;

import java.util.List;

/**
 * Capability consumed from the raw embedding backend.
 *
 * Implementations perform no retries; retries are layered above the
 * performance layer. Implementations must be thread-safe as batches call
 * them concurrently.
 */
public interface EmbeddingBackend {

    /**
     * Returns the name of this backend for cache namespacing and metrics.
     */
    String name();

    /**
     * Generates one fixed-length vector per input text, in input order.
     *
     * @param texts texts to embed
     * @return vectors, {@code result.get(i)} embeds {@code texts.get(i)}
     * @throws Exception on any backend failure, transient or not
     */
    List<float[]> generateEmbeddings(List<String> texts) throws Exception;

    /**
     * Returns the vector length produced by this backend.
     */
    int dimension();
}
