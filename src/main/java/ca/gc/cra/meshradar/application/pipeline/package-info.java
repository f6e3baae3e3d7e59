/**
 * <strong>Purpose:</strong> Ingestion pipeline orchestration: source hand-off, decode workers, and the store stage.
 * <p><strong>Concurrency:</strong> Stages are connected by bounded queues; worker pools come from
 * {@code ExecutorFactories}.</p>
 * <p><strong>Observability:</strong> Emits {@code ingest.*} metrics and sets the {@code pipeline} MDC key.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.meshradar.application.pipeline;
