package ca.gc.cra.fluxbatch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fluxbatch.domain.batch.BatchPlan;
import ca.gc.cra.fluxbatch.domain.batch.ControlFileEntry;
import ca.gc.cra.fluxbatch.domain.batch.ControlFileSet;
import ca.gc.cra.fluxbatch.domain.batch.RunMode;
import ca.gc.cra.fluxbatch.domain.batch.SiteManifest;
import ca.gc.cra.fluxbatch.domain.level.IterationOrder;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BatchControlFileLoaderTest {
  @TempDir Path dir;

  private final BatchControlFileLoader loader = new BatchControlFileLoader();

  @Test
  void levelsModeParsesTokensAndResolvesRelativePaths() throws IOException {
    Path control = write("""
        Options:
          levels: l1, l2 , concatenate
        Levels:
          l1:
            2: site_b/L1.yml
            1: site_a/L1.yml
        """);

    BatchPlan plan = loader.load(control, RunMode.LEVELS);

    assertEquals(List.of("l1", "l2", "concatenate"), plan.levelTokens());
    ControlFileSet l1 = plan.controlFilesFor("L1").orElseThrow();
    List<ControlFileEntry> ordered = l1.inOrder(IterationOrder.NUMERIC_ASCENDING);
    assertEquals("1", ordered.get(0).key());
    assertEquals(dir.resolve("site_a/L1.yml").toAbsolutePath().normalize(), ordered.get(0).locator());
    assertTrue(plan.controlFilesFor("l2").isEmpty());
  }

  @Test
  void levelsEntryMayBeAList() throws IOException {
    Path control = write("""
        Options:
          levels: [l3, l4]
        """);

    assertEquals(List.of("l3", "l4"), loader.load(control, RunMode.LEVELS).levelTokens());
  }

  @Test
  void absolutePathsAreKept() throws IOException {
    Path absolute = dir.resolve("elsewhere/L1.yml").toAbsolutePath();
    Path control = write("Options:\n  levels: l1\nLevels:\n  l1:\n    1: " + absolute + "\n");

    ControlFileSet l1 = loader.load(control, RunMode.LEVELS).controlFilesFor("l1").orElseThrow();

    assertEquals(absolute, l1.inOrder(IterationOrder.DECLARATION).get(0).locator());
  }

  @Test
  void levelsModeRequiresOptionsAndLevelsEntry() throws IOException {
    Path noOptions = write("Levels:\n  l1:\n    1: a.yml\n");
    assertThrows(IllegalArgumentException.class, () -> loader.load(noOptions, RunMode.LEVELS));

    Path blankLevels = write("Options:\n  levels: ' '\n");
    assertThrows(IllegalArgumentException.class, () -> loader.load(blankLevels, RunMode.LEVELS));
  }

  @Test
  void sitesModeParsesSitesInDeclarationOrder() throws IOException {
    Path control = write("""
        Sites:
          SiteB:
            1: b/L1.yml
          SiteA:
            10: a/L2.yml
            2: a/L1.yml
        """);

    BatchPlan plan = loader.load(control, RunMode.SITES);

    assertEquals(2, plan.sites().size());
    SiteManifest siteA = plan.sites().get(1);
    assertEquals("SiteA", siteA.site());
    assertEquals(List.of("2", "10"), siteA.inOrder().stream().map(ControlFileEntry::key).toList());
    assertTrue(plan.levelTokens().isEmpty());
  }

  @Test
  void sitesModeRequiresSitesSection() throws IOException {
    Path control = write("Options:\n  levels: l1\n");

    assertThrows(IllegalArgumentException.class, () -> loader.load(control, RunMode.SITES));
  }

  @Test
  void rejectsMalformedStructure() throws IOException {
    Path nonInteger = write("Options:\n  levels: l1\nLevels:\n  l1:\n    first: a.yml\n");
    assertThrows(IllegalArgumentException.class, () -> loader.load(nonInteger, RunMode.LEVELS));

    Path blankPath = write("Options:\n  levels: l1\nLevels:\n  l1:\n    1: ''\n");
    assertThrows(IllegalArgumentException.class, () -> loader.load(blankPath, RunMode.LEVELS));

    Path scalarSection = write("Options: l1\n");
    assertThrows(IllegalArgumentException.class, () -> loader.load(scalarSection, RunMode.LEVELS));

    Path badSite = write("Sites:\n  '../etc':\n    1: a.yml\n");
    assertThrows(IllegalArgumentException.class, () -> loader.load(badSite, RunMode.SITES));

    Path notMapping = write("- l1\n- l2\n");
    assertThrows(IllegalArgumentException.class, () -> loader.load(notMapping, RunMode.LEVELS));
  }

  @Test
  void missingFileIsAnIoError() {
    assertThrows(IOException.class, () -> loader.load(dir.resolve("absent.yml"), RunMode.LEVELS));
  }

  private Path write(String yaml) throws IOException {
    Path file = dir.resolve("batch.yml");
    Files.writeString(file, yaml, StandardCharsets.UTF_8);
    return file;
  }
}
