package ca.gc.cra.fluxbatch.testutil;

import ca.gc.cra.fluxbatch.application.port.LevelResultSink;
import ca.gc.cra.fluxbatch.domain.batch.LevelResult;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/** Collects every {@link LevelResult} in arrival order. */
public final class RecordingSink implements LevelResultSink {
  private final List<LevelResult> results = new CopyOnWriteArrayList<>();

  @Override
  public void accept(LevelResult result) {
    results.add(result);
  }

  public List<LevelResult> results() {
    return List.copyOf(results);
  }

  public List<LevelResult.Status> statuses() {
    return results.stream().map(LevelResult::status).collect(Collectors.toList());
  }

  public List<String> manifests() {
    return results.stream().map(LevelResult::manifest).collect(Collectors.toList());
  }
}
