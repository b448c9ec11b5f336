package ca.gc.cra.fluxbatch.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fluxbatch.domain.level.LevelId;
import java.util.List;
import org.junit.jupiter.api.Test;

class ListLevelsCliTest {

  @Test
  void tableHasHeaderAndOneRowPerLevel() {
    List<String> table = ListLevelsCli.table();

    assertEquals(LevelId.values().length + 1, table.size());
    assertTrue(table.get(0).startsWith("TOKEN"));
    assertTrue(table.stream().anyMatch(row -> row.startsWith("l1 ") && row.endsWith("yes")));
  }
}
