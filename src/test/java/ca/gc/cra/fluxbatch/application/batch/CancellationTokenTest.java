package ca.gc.cra.fluxbatch.application.batch;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CancellationTokenTest {

  @Test
  void firstRequestWinsAndLaterOnesAreNoOps() {
    CancellationToken token = CancellationToken.create();

    assertFalse(token.isStopRequested());
    assertTrue(token.requestStop());
    assertFalse(token.requestStop());
    assertTrue(token.isStopRequested());
  }

  @Test
  void noneTokenIgnoresStopRequests() {
    CancellationToken token = CancellationToken.none();

    assertFalse(token.isCancellable());
    assertFalse(token.requestStop());
    assertFalse(token.isStopRequested());
  }
}
