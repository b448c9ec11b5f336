/**
 * Visualization adapters for fingerprint and manifest plots.
 */
package ca.gc.cra.fluxbatch.infrastructure.plot;
