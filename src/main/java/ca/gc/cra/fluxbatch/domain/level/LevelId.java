package ca.gc.cra.fluxbatch.domain.level;

import static ca.gc.cra.fluxbatch.domain.level.ArtifactKind.ANY_DATASET;
import static ca.gc.cra.fluxbatch.domain.level.IterationOrder.DECLARATION;
import static ca.gc.cra.fluxbatch.domain.level.IterationOrder.NUMERIC_ASCENDING;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Closed set of processing levels the batch orchestrator knows how to dispatch.
 * <p><strong>Why:</strong> Replaces free-form level strings with a typed identifier so the dispatch table, iteration
 * policy, and post-processing side effects are explicit and testable.</p>
 * <p><strong>Role:</strong> Domain value consumed by the level registry, runner, and site dispatcher.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Map operator tokens ({@code "L4"}, {@code " cpd_barr "}) onto identifiers case-insensitively.</li>
 *   <li>Declare each level's iteration order, predecessor artifact, and side effect.</li>
 *   <li>Record whether a level may appear inside a per-site manifest list.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum LevelId {
  L1("l1", "L1 processing", DECLARATION, ArtifactKind.RAW_DATA, SideEffect.NONE, true),
  L2("l2", "L2 processing", DECLARATION, ArtifactKind.L1_DATASET, SideEffect.MANIFEST_PLOTS, true),
  L3("l3", "L3 processing", DECLARATION, ArtifactKind.L2_DATASET, SideEffect.MANIFEST_PLOTS, true),
  ECOSTRESS("ecostress", "ECOSTRESS output", DECLARATION, ANY_DATASET, SideEffect.NONE, false),
  FLUXNET("fluxnet", "FluxNet output", DECLARATION, ANY_DATASET, SideEffect.NONE, false),
  REDDYPROC("reddyproc", "REddyProc output", DECLARATION, ANY_DATASET, SideEffect.NONE, false),
  CONCATENATE("concatenate", "concatenation", NUMERIC_ASCENDING, ANY_DATASET, SideEffect.FINGERPRINT, true),
  CLIMATOLOGY("climatology", "climatology", DECLARATION, ANY_DATASET, SideEffect.NONE, true),
  CPD_BARR("cpd_barr", "CPD (Barr)", DECLARATION, ANY_DATASET, SideEffect.NONE, true),
  CPD_MCHUGH("cpd_mchugh", "CPD (McHugh)", DECLARATION, ANY_DATASET, SideEffect.NONE, true),
  CPD_MCNEW("cpd_mcnew", "CPD (McNew)", DECLARATION, ANY_DATASET, SideEffect.NONE, true),
  MPT("mpt", "MPT", DECLARATION, ANY_DATASET, SideEffect.NONE, true),
  L4("l4", "L4 processing", NUMERIC_ASCENDING, ArtifactKind.L3_DATASET, SideEffect.FINGERPRINT, true),
  L5("l5", "L5 processing", NUMERIC_ASCENDING, ArtifactKind.L4_DATASET, SideEffect.FINGERPRINT, true),
  L6("l6", "L6 processing", DECLARATION, ArtifactKind.L5_DATASET, SideEffect.NONE, true);

  private static final Map<String, LevelId> BY_TOKEN = indexByToken();

  private final String token;
  private final String label;
  private final IterationOrder iterationOrder;
  private final ArtifactKind predecessor;
  private final SideEffect sideEffect;
  private final boolean siteDispatchable;

  LevelId(
      String token,
      String label,
      IterationOrder iterationOrder,
      ArtifactKind predecessor,
      SideEffect sideEffect,
      boolean siteDispatchable) {
    this.token = token;
    this.label = label;
    this.iterationOrder = iterationOrder;
    this.predecessor = predecessor;
    this.sideEffect = sideEffect;
    this.siteDispatchable = siteDispatchable;
  }

  /**
   * Resolves an operator-supplied token to a level identifier.
   *
   * @param raw token such as {@code "L1"} or {@code "concatenate"}; {@code null} yields empty
   * @return matching identifier, or empty when the token is not a known level
   */
  public static Optional<LevelId> fromToken(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return Optional.ofNullable(BY_TOKEN.get(normalized));
  }

  /**
   * Returns the canonical lower-case token used in control files.
   *
   * @return token (for example {@code "cpd_mchugh"})
   */
  public String token() {
    return token;
  }

  /**
   * Returns the label used in "Starting ... with ..." log lines.
   *
   * @return human-readable label
   */
  public String label() {
    return label;
  }

  /**
   * Returns the order in which this level visits its control files.
   *
   * @return iteration policy
   */
  public IterationOrder iterationOrder() {
    return iterationOrder;
  }

  /**
   * Returns the artifact kind this level reads.
   *
   * @return predecessor artifact kind
   */
  public ArtifactKind predecessor() {
    return predecessor;
  }

  /**
   * Returns the step executed after a successful handler call.
   *
   * @return post-success side effect
   */
  public SideEffect sideEffect() {
    return sideEffect;
  }

  /**
   * Indicates whether the level may be declared inside a per-site manifest list.
   *
   * @return {@code true} when the site dispatcher accepts this level
   */
  public boolean siteDispatchable() {
    return siteDispatchable;
  }

  private static Map<String, LevelId> indexByToken() {
    Map<String, LevelId> map = new LinkedHashMap<>();
    for (LevelId id : values()) {
      map.put(id.token, id);
    }
    return Collections.unmodifiableMap(map);
  }
}
