package ca.gc.cra.fluxbatch.api;

import ca.gc.cra.fluxbatch.domain.level.LevelId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Prints the known level table: token, label, manifest order, post-success step, and site eligibility.
 */
final class ListLevelsCli {
  private static final String ROW = "%-12s %-20s %-18s %-15s %s";

  private ListLevelsCli() {}

  static ExitCode run(String[] args) {
    CliPrinter.printLines(table());
    return ExitCode.SUCCESS;
  }

  static List<String> table() {
    List<String> lines = new ArrayList<>();
    lines.add(String.format(Locale.ROOT, ROW, "TOKEN", "LABEL", "ORDER", "AFTER SUCCESS", "SITES"));
    for (LevelId level : LevelId.values()) {
      lines.add(String.format(Locale.ROOT, ROW,
          level.token(),
          level.label(),
          level.iterationOrder().name().toLowerCase(Locale.ROOT),
          level.sideEffect().name().toLowerCase(Locale.ROOT),
          level.siteDispatchable() ? "yes" : "no"));
    }
    return lines;
  }
}
