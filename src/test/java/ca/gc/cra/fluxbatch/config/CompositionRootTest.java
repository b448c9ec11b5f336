package ca.gc.cra.fluxbatch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fluxbatch.application.batch.BatchSession;
import ca.gc.cra.fluxbatch.application.batch.LevelRegistry;
import ca.gc.cra.fluxbatch.application.port.ClockPort;
import ca.gc.cra.fluxbatch.application.port.VisualizationPort;
import ca.gc.cra.fluxbatch.domain.batch.BatchPlan;
import ca.gc.cra.fluxbatch.domain.batch.RunMode;
import ca.gc.cra.fluxbatch.domain.batch.SessionMode;
import ca.gc.cra.fluxbatch.domain.batch.SessionState;
import ca.gc.cra.fluxbatch.domain.level.LevelId;
import ca.gc.cra.fluxbatch.testutil.RecordingMetrics;
import ca.gc.cra.fluxbatch.testutil.RecordingSink;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CompositionRootTest {

  @Test
  void registersOneHandlerPerConfiguredCommand() {
    CompositionRoot root = root(Map.of("handler.l1", "l1-proc {manifest}", "handler.l4", "l4-proc {manifest}"));

    LevelRegistry registry = root.levelRegistry();

    assertEquals(Set.of(LevelId.L1, LevelId.L4), registry.registeredLevels());
    assertTrue(registry.lookup("l2").isEmpty());
  }

  @Test
  void unterminatedHandlerCommandIsRejected() {
    CompositionRoot root = root(Map.of("handler.l2", "l2-proc \"{manifest}"));

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, root::levelRegistry);
    assertTrue(ex.getMessage().startsWith("Invalid handler.l2 command"));
  }

  @Test
  void visualizationIsDisabledWithoutCommands() {
    assertSame(VisualizationPort.NONE, root(Map.of()).visualization());
    assertNotSame(VisualizationPort.NONE, root(Map.of("plotCommand", "plot {plot}")).visualization());
  }

  @Test
  void buildsIdleSessionForPlan() {
    BatchSession session = root(Map.of("sessionMode", "interactive"))
        .batchSession(new BatchPlan(List.of("l1"), Map.of(), List.of()));

    assertEquals(SessionState.IDLE, session.state());
    assertEquals(RunMode.SITES, session.runMode());
    assertEquals(SessionMode.INTERACTIVE, session.sessionMode());
  }

  private static CompositionRoot root(Map<String, String> settings) {
    Map<String, String> options = new HashMap<>(settings);
    options.put("control", "batch.yml");
    BatchConfig config = BatchConfig.fromMap(RunMode.SITES, options);
    return new CompositionRoot(config, new RecordingMetrics(), new RecordingSink(), ClockPort.SYSTEM);
  }
}
