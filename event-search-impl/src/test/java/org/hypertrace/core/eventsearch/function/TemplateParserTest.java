package org.hypertrace.core.eventsearch.function;

import static org.hypertrace.core.eventsearch.function.ExpressionTemplate.argument;
import static org.hypertrace.core.eventsearch.function.ExpressionTemplate.call;
import static org.hypertrace.core.eventsearch.function.ExpressionTemplate.constant;
import static org.hypertrace.core.eventsearch.function.ExpressionTemplate.field;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class TemplateParserTest {

  @Test
  public void testCalls() {
    assertEquals(
        call("divide", call("count"), argument("interval")),
        TemplateParser.parse("divide(count(), {interval})"));
    assertEquals(
        call(
            "uniqIf",
            argument("column"),
            call("greater", field("transaction.duration"), argument("tolerated"))),
        TemplateParser.parse("uniqIf({column}, greater(transaction.duration, {tolerated}))"));
  }

  @Test
  public void testParametricName() {
    ExpressionTemplate template = TemplateParser.parse("quantile({percentile:g})({column})");
    assertEquals(call("quantile({percentile:g})", argument("column")), template);

    Set<String> placeholders = new HashSet<>();
    template.collectPlaceholders(placeholders);
    assertEquals(Set.of("percentile", "column"), placeholders);

    assertEquals(
        call("quantile(0.95)", field("transaction.duration")),
        TemplateParser.parse("quantile(0.95)(transaction.duration)"));
  }

  @Test
  public void testConstants() {
    assertEquals(
        call("if", call("equals", argument("a"), constant("it's")), constant(null), constant(-1.5)),
        TemplateParser.parse("if(equals({a}, 'it\\'s'), null, -1.5)"));
    assertEquals(
        call("array", constant(0L), constant(1L), constant(2L)),
        TemplateParser.parse("array(0, 1, 2)"));
  }

  @Test
  public void testMalformed() {
    assertThrows(IllegalStateException.class, () -> TemplateParser.parse("divide(count()"));
    assertThrows(IllegalStateException.class, () -> TemplateParser.parse("count() extra"));
    assertThrows(IllegalStateException.class, () -> TemplateParser.parse("f({column)"));
    assertThrows(IllegalStateException.class, () -> TemplateParser.parse("f('open)"));
    assertThrows(IllegalStateException.class, () -> TemplateParser.parse(""));
  }
}
