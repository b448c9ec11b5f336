/**
 * <strong>Purpose:</strong> Batch orchestration: the level registry, the sequential level runner, the parallel site
 * dispatcher, and the batch session that drives them.
 * <p><strong>Concurrency:</strong> The site dispatcher is the only source of threads; everything else runs on the
 * caller's thread. Cancellation is cooperative through {@link ca.gc.cra.fluxbatch.application.batch.CancellationToken}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fluxbatch.application.batch;
