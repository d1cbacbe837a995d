package ca.gc.cra.premis.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("local:obj-1", Logs.truncate((Object) "local:obj-1"));
  }

  @Test
  void nullRendersPlaceholder() {
    assertEquals("<null>", Logs.truncate(null));
  }

  @Test
  void longValuesAreTruncatedWithLength() {
    String truncated = Logs.truncate("x".repeat(300), 10);

    assertTrue(truncated.startsWith("xxxxxxxxxx..."));
    assertTrue(truncated.contains("10 of 300"));
  }

  @Test
  void multiByteBoundaryDoesNotFail() {
    String truncated = Logs.truncate("ééééé", 3);

    assertTrue(truncated.startsWith("é"));
  }

  @Test
  void rejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("value", 0));
  }
}
