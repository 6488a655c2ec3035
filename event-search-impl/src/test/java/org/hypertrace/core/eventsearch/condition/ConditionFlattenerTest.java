package org.hypertrace.core.eventsearch.condition;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.and;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.columnCondition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.or;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.hypertrace.core.eventsearch.api.Condition;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.junit.jupiter.api.Test;

public class ConditionFlattenerTest {
  private final Condition a = columnCondition("a", ConditionOperator.EQ, 1L);
  private final Condition b = columnCondition("b", ConditionOperator.EQ, 2L);
  private final Condition c = columnCondition("c", ConditionOperator.GT, 3L);

  @Test
  public void testNestedAnds() {
    assertEquals(List.of(a, b, c), ConditionFlattener.flatten(and(a, and(b, c))));
    assertEquals(List.of(a, b, c), ConditionFlattener.flatten(and(and(a, b), c)));
  }

  @Test
  public void testOrIsKeptWhole() {
    Condition either = or(a, and(b, c));
    assertEquals(List.of(either), ConditionFlattener.flatten(either));
    assertEquals(List.of(a, either), ConditionFlattener.flatten(and(a, either)));
  }

  @Test
  public void testIdempotent() {
    List<Condition> flattened = ConditionFlattener.flatten(and(a, and(b, or(a, c))));
    assertEquals(flattened, ConditionFlattener.flatten(flattened));
  }
}
