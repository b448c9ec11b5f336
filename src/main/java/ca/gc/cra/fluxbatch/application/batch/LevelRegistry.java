package ca.gc.cra.fluxbatch.application.batch;

import ca.gc.cra.fluxbatch.application.port.LevelHandler;
import ca.gc.cra.fluxbatch.domain.level.LevelId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Immutable dispatch table from level identifier to handler.
 * <p><strong>Why:</strong> Unknown or unbound level tokens must be reported and skipped, never raised; the registry
 * answers with an empty result instead of throwing.</p>
 * <p><strong>Role:</strong> Built once by the composition root; read by the batch session and the site
 * dispatcher.</p>
 * <p><strong>Thread-safety:</strong> Immutable after {@link Builder#build()}; safe for concurrent lookups.</p>
 *
 * @since 0.1.0
 */
public final class LevelRegistry {
  private static final Logger log = LoggerFactory.getLogger(LevelRegistry.class);

  private final Map<LevelId, RegisteredLevel> entries;

  private LevelRegistry(Map<LevelId, RegisteredLevel> entries) {
    this.entries = Collections.unmodifiableMap(entries);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Resolves an operator token.
   *
   * @param token raw level token; case and surrounding whitespace are ignored
   * @return registered level, or empty when the token is unknown or has no handler
   */
  public Optional<RegisteredLevel> lookup(String token) {
    return LevelId.fromToken(token).flatMap(this::lookup);
  }

  /**
   * Resolves a level identifier.
   *
   * @param id level identifier
   * @return registered level, or empty when no handler is bound
   */
  public Optional<RegisteredLevel> lookup(LevelId id) {
    return Optional.ofNullable(entries.get(id));
  }

  /**
   * Returns the levels that have a handler.
   *
   * @return registered identifiers in declaration order
   */
  public Set<LevelId> registeredLevels() {
    return entries.keySet();
  }

  public int size() {
    return entries.size();
  }

  /** Collects handler bindings before the registry is frozen. */
  public static final class Builder {
    private final Map<LevelId, RegisteredLevel> entries = new EnumMap<>(LevelId.class);

    private Builder() {}

    /**
     * Binds a handler to a level, replacing any earlier binding.
     *
     * @param id level identifier
     * @param handler handler invoked per manifest
     * @return this builder
     */
    public Builder register(LevelId id, LevelHandler handler) {
      entries.put(Objects.requireNonNull(id, "id"), new RegisteredLevel(id, handler));
      return this;
    }

    /**
     * Freezes the bindings.
     *
     * @return immutable registry
     */
    public LevelRegistry build() {
      for (LevelId id : LevelId.values()) {
        if (!entries.containsKey(id)) {
          log.debug("No handler configured for level {}; it will be reported as unrecognised", id.token());
        }
      }
      return new LevelRegistry(new EnumMap<>(entries));
    }
  }
}
