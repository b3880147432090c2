package sqlgate.exec;

import org.junit.jupiter.api.Test;
import sqlgate.InvalidExpressionException;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryExpressionTest {

  @Test
  void splitsExecutableFromParams() {
    QueryExpression expr = QueryExpression.of(List.of("select $1 as x", 42));

    assertEquals("select $1 as x", expr.executable());
    assertEquals(List.of(42), expr.params());
  }

  @Test
  void executableAlone() {
    QueryExpression expr = QueryExpression.of("select 1");

    assertTrue(expr.params().isEmpty());
  }

  @Test
  void paramsAreCopied() {
    List<Object> vector = new ArrayList<>(List.of("select ?", 1));
    QueryExpression expr = QueryExpression.of(vector);
    vector.add(2);

    assertEquals(List.of(1), expr.params());
    assertThrows(UnsupportedOperationException.class, () -> expr.params().add(3));
  }

  @Test
  void emptyVectorIsRejected() {
    assertThrows(InvalidExpressionException.class, () -> QueryExpression.of(List.of()));
    assertThrows(InvalidExpressionException.class, () -> QueryExpression.of((List<?>) null));
  }
}
