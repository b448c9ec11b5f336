/**
 * Batch units of work: control file sets, manifests, per-site lists, and per-manifest results.
 */
package ca.gc.cra.fluxbatch.domain.batch;
