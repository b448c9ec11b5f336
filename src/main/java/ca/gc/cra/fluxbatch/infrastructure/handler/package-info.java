/**
 * Level handlers backed by external commands.
 */
package ca.gc.cra.fluxbatch.infrastructure.handler;
