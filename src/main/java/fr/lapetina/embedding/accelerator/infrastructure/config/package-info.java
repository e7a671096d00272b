/**
 * Configuration loading and hot-reload support.
 *
 * <p>This package handles YAML configuration parsing and runtime configuration updates
 * without requiring application restart.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.embedding.accelerator.infrastructure.config.AcceleratorConfig} - Configuration model</li>
 *   <li>{@link fr.lapetina.embedding.accelerator.infrastructure.config.ConfigLoader} - YAML loading and file watching</li>
 *   <li>{@link fr.lapetina.embedding.accelerator.infrastructure.config.ConfigChangeListener} - Callback for configuration changes</li>
 * </ul>
 *
 * <h2>Hot-Reload</h2>
 * <p>Configuration changes are detected via file system watching. A reloaded file is validated
 * first; an invalid file is logged and the current configuration stays in effect. Only the
 * batch size is applied to a running context, other sections take effect on the next context.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code cache} - Memory tier entry bound, disk tier directory and byte bound</li>
 *   <li>{@code rateLimit} - Token bucket rate and burst</li>
 *   <li>{@code batch} - Batch size, concurrency and timeout</li>
 *   <li>{@code optimizer} - Calibration strategy, latency ceiling and candidate range</li>
 *   <li>{@code pool} - Free list bound per size class</li>
 *   <li>{@code monitor} - Collection interval, history and alert rules</li>
 *   <li>{@code circuitBreaker} - Backend failure threshold and recovery time</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 *
 * @see fr.lapetina.embedding.accelerator.infrastructure.config.AcceleratorConfig
 * @see fr.lapetina.embedding.accelerator.infrastructure.config.ConfigLoader
 */
package fr.lapetina.embedding.accelerator.infrastructure.config;
