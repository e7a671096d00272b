package fr.lapetina.embedding.accelerator.pipeline;

import java.util.List;

/**
 * Outcome of {@link EmbeddingPipeline#processDocuments(List)}.
 *
 * @param embeddings one vector per document, in input order
 */
public record PipelineResult(
        List<float[]> embeddings,
        int numDocuments,
        int dimension,
        double durationSeconds,
        double throughputDocsPerSec,
        long errors
) {
}
