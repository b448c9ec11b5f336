/**
 * Logging setup helpers for the CLI.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fluxbatch.logging;
