/**
 * YAML manifest loading, writing, and compliance normalization.
 */
package ca.gc.cra.fluxbatch.infrastructure.manifest;
