/**
 * Result sinks for per-manifest outcomes.
 */
package ca.gc.cra.fluxbatch.infrastructure.events;
