/**
 * Executor factories for the site worker pool.
 */
package ca.gc.cra.fluxbatch.infrastructure.exec;
