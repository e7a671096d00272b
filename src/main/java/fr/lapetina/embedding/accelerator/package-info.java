/**
 * Embedding Accelerator - adaptive performance layer between an embedding backend and its callers.
 *
 * <p>The layer decides how many texts to batch together, how fast to call the backend,
 * where to cache vectors that were already computed and how to reuse large numeric buffers.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.embedding.accelerator.AcceleratorContext} - Main entry point wiring
 *       every component from YAML configuration</li>
 *   <li>{@link fr.lapetina.embedding.accelerator.pipeline.EmbeddingPipeline} - Cached, rate-limited,
 *       batched embedding generation</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (AcceleratorContext context = AcceleratorContext.create("accelerator.yaml", backend).start()) {
 *     EmbeddingPipeline pipeline = context.getPipeline();
 *     pipeline.tune(sampleTexts);
 *     List<float[]> vectors = pipeline.embedAll(texts);
 *     System.out.println(context.getMonitor().getSummaryJson(Duration.ofMinutes(5)));
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Memory and disk cache tiers with promotion on hit</li>
 *   <li>Token bucket rate limiting with FIFO waiters</li>
 *   <li>Concurrent batch processing with ordered reassembly</li>
 *   <li>Batch size calibration with latency, throughput and balanced objectives</li>
 *   <li>Pooled float arrays and byte buffers</li>
 *   <li>Profiling, background monitoring and threshold alerts</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.embedding.accelerator.AcceleratorContext
 * @see fr.lapetina.embedding.accelerator.pipeline.EmbeddingPipeline
 */
package fr.lapetina.embedding.accelerator;
