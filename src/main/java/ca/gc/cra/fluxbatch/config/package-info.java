/**
 * Configuration loading, merging, and wiring for the batch commands.
 * <p><strong>Role:</strong> Turns CLI arguments, an optional YAML file, and embedded defaults into a
 * {@link ca.gc.cra.fluxbatch.config.BatchConfig}; parses the batch control file into a plan; and builds the object
 * graph in {@link ca.gc.cra.fluxbatch.config.CompositionRoot}.</p>
 * <p><strong>Precedence:</strong> CLI &gt; YAML &gt; defaults.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fluxbatch.config;
