/**
 * Command-line entry points for fluxbatch.
 * <p><strong>Role:</strong> Driving adapter; parses arguments, configures logging and telemetry, builds the
 * configuration, and runs a batch session.</p>
 * <p><strong>Output:</strong> Usage text and dry-run plans go to stdout through {@code CliPrinter}; everything else
 * is logged through SLF4J.</p>
 */
package ca.gc.cra.fluxbatch.api;
