package org.hypertrace.core.eventsearch.function;

import static org.hypertrace.core.eventsearch.function.FunctionArguments.numericColumn;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.string;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class FunctionRegistryTest {
  private final FunctionRegistry registry = new FunctionRegistry();

  @Test
  public void testAliasedFunctions() {
    FunctionSpec tpm = registry.get("tpm").orElseThrow();
    FunctionSpec epm = registry.get("epm").orElseThrow();
    assertEquals("tpm", tpm.getName());
    assertEquals(epm.getEmission(), tpm.getEmission());
    assertTrue(registry.contains("tps"));
    assertFalse(registry.contains("tpx"));
  }

  @Test
  public void testPrivateFunctions() {
    FunctionSpec histogram = registry.get("histogram").orElseThrow();
    assertTrue(histogram.isPrivate());
    assertFalse(histogram.isAccessible(List.of()));
    assertTrue(histogram.isAccessible(Set.of("histogram")));
    assertTrue(registry.get("array_join").orElseThrow().isPrivate());
    assertTrue(registry.get("count").orElseThrow().isAccessible(List.of()));
  }

  @Test
  public void testArgumentCounts() {
    FunctionSpec userMisery = registry.get("user_misery").orElseThrow();
    assertEquals(0, userMisery.getRequiredArgumentCount());
    assertEquals(3, userMisery.getTotalArgumentCount());
    assertEquals(2, userMisery.getCalculatedArguments().size());

    FunctionSpec toOther = registry.get("to_other").orElseThrow();
    assertEquals(2, toOther.getRequiredArgumentCount());
    assertEquals(4, toOther.getTotalArgumentCount());
  }

  @Test
  public void testAggregates() {
    assertTrue(registry.get("p95").orElseThrow().isAggregate());
    assertTrue(registry.get("apdex").orElseThrow().isAggregate());
    assertFalse(registry.get("to_other").orElseThrow().isAggregate());
    assertFalse(registry.get("absolute_delta").orElseThrow().isAggregate());
    assertTrue(registry.get("max").orElseThrow().isRedundantGrouping());
    assertFalse(registry.get("sum").orElseThrow().isRedundantGrouping());
  }

  @Test
  public void testBuilderChecks() {
    assertThrows(
        IllegalStateException.class,
        () -> FunctionSpec.builder("nothing").required(numericColumn("column")).build());
    assertThrows(
        IllegalStateException.class,
        () ->
            FunctionSpec.builder("no_default")
                .optional(numericColumn("column"))
                .emits(Emission.aggregate("sum({column})"))
                .build());
    assertThrows(
        IllegalStateException.class,
        () ->
            FunctionSpec.builder("twice")
                .required(numericColumn("column"), string("column"))
                .emits(Emission.aggregate("sum({column})"))
                .build());
    assertThrows(
        IllegalStateException.class,
        () ->
            FunctionSpec.builder("undeclared")
                .required(numericColumn("column"))
                .emits(Emission.aggregate("sum({other})"))
                .build());
  }
}
