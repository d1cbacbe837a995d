package ca.gc.cra.premis.domain.premis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import org.junit.jupiter.api.Test;

class DuplicateIdentifierExceptionTest {

  @Test
  void messageNamesKindAndIdentifier() {
    Identifier id = Identifier.of("local", "evt-1");
    DuplicateIdentifierException ex = new DuplicateIdentifierException(RecordKind.EVENT, id);

    assertEquals("duplicate event identifier local:evt-1", ex.getMessage());
    assertEquals(RecordKind.EVENT, ex.kind());
    assertEquals(id, ex.identifier());
    assertInstanceOf(IllegalArgumentException.class, ex);
  }
}
