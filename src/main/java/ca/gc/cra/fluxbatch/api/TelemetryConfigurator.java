package ca.gc.cra.fluxbatch.api;

import ca.gc.cra.fluxbatch.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the telemetry settings out of the effective configuration and into the system properties read when
 * OpenTelemetry is bootstrapped.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  static final String EXPORTER_PROPERTY = "otel.metrics.exporter";
  static final String ENDPOINT_PROPERTY = "otel.exporter.otlp.endpoint";
  static final String RESOURCE_PROPERTY = "otel.resource.attributes";

  private TelemetryConfigurator() {}

  /**
   * Applies and removes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}.
   *
   * @param settings mutable effective settings
   * @throws IllegalArgumentException if a telemetry value is invalid
   */
  static void configureMetrics(Map<String, String> settings) {
    String exporter = trimmed(settings.remove("metricsExporter"));
    if (!exporter.isEmpty()) {
      String normalized = exporter.toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Metrics exporter: {}", normalized);
      System.setProperty(EXPORTER_PROPERTY, normalized);
    }

    String endpoint = trimmed(settings.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      requireHttpEndpoint(endpoint);
      log.debug("OTLP endpoint: {}", endpoint);
      System.setProperty(ENDPOINT_PROPERTY, endpoint);
    }

    String attributes = trimmed(settings.remove("otelResourceAttributes"));
    if (!attributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty(RESOURCE_PROPERTY, attributes);
    }
  }

  private static void requireHttpEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
