package com.gentoro.capindex.diagnostics;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class WarningCollectorTest {

  @Test
  void collectsFromManyThreads() throws Exception {
    WarningCollector collector = new WarningCollector();
    ExecutorService pool = Executors.newFixedThreadPool(4);
    for (int i = 0; i < 200; i++) {
      String id = "el-" + i;
      pool.submit(() -> collector.add(WarningCode.SCORING_FAILURE, id, "failed"));
    }
    pool.shutdown();
    assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

    assertEquals(200, collector.size());
    assertTrue(collector.contains(WarningCode.SCORING_FAILURE));
    assertFalse(collector.contains(WarningCode.RULE_FAILURE));
  }

  @Test
  void snapshotIsDetached() {
    WarningCollector collector = new WarningCollector();
    collector.add(WarningCode.TRIGGER_LIMIT, "a", "too many");
    List<BuildWarning> snapshot = collector.snapshot();
    collector.add(WarningCode.DEADLINE_EXCEEDED, null, "late");

    assertEquals(1, snapshot.size());
    assertThrows(UnsupportedOperationException.class, () -> snapshot.add(snapshot.get(0)));
  }

  @Test
  void unknownWireCodesDegradeToUnknown() {
    assertEquals(WarningCode.RULE_FAILURE, WarningCode.fromValue("rule_failure"));
    assertEquals(WarningCode.UNKNOWN, WarningCode.fromValue("something_new"));
    assertEquals(WarningCode.UNKNOWN, WarningCode.fromValue(null));
    assertEquals("deadline_exceeded", WarningCode.DEADLINE_EXCEEDED.wireName());
  }
}
