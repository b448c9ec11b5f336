package ca.gc.cra.fluxbatch.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeIsInclusive() {
    assertEquals(1L, Numbers.requireRange("n", 1, 1, 3));
    assertEquals(3L, Numbers.requireRange("n", 3, 1, 3));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("n", 4, 1, 3));
  }

  @Test
  void parseFallsBackToDefaultWhenBlank() {
    assertEquals(5, Numbers.parseIntInRange("poolSize", null, 5, 1, 64));
    assertEquals(5, Numbers.parseIntInRange("poolSize", " ", 5, 1, 64));
  }

  @Test
  void parseTrimsAndValidates() {
    assertEquals(12, Numbers.parseIntInRange("poolSize", " 12 ", 5, 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("poolSize", "x", 5, 1, 64));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("poolSize", "99999999999", 5, 1, 64));
  }
}
