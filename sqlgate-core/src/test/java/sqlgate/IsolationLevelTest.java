package sqlgate;

import org.junit.jupiter.api.Test;

import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IsolationLevelTest {

  @Test
  void parsesKeywordsLeniently() {
    assertEquals(IsolationLevel.SERIALIZABLE, IsolationLevel.of("serializable"));
    assertEquals(IsolationLevel.READ_COMMITTED, IsolationLevel.of("READ_COMMITTED"));
    assertEquals(IsolationLevel.REPEATABLE_READ, IsolationLevel.of(" repeatable read "));
    assertEquals(IsolationLevel.READ_UNCOMMITTED, IsolationLevel.of(IsolationLevel.READ_UNCOMMITTED));
  }

  @Test
  void mapsToJdbcConstants() {
    assertEquals(Connection.TRANSACTION_SERIALIZABLE, IsolationLevel.SERIALIZABLE.jdbcLevel());
    assertEquals(Connection.TRANSACTION_READ_COMMITTED, IsolationLevel.READ_COMMITTED.jdbcLevel());
    assertEquals("repeatable-read", IsolationLevel.REPEATABLE_READ.keyword());
  }

  @Test
  void rejectsUnknownValues() {
    assertThrows(IllegalArgumentException.class, () -> IsolationLevel.of("snapshot"));
    assertThrows(IllegalArgumentException.class, () -> IsolationLevel.of(8));
    assertThrows(IllegalArgumentException.class, () -> IsolationLevel.of(null));
  }
}
