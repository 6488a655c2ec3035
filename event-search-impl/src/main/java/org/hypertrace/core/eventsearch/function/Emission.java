package org.hypertrace.core.eventsearch.function;

import java.util.HashSet;
import java.util.Set;
import javax.annotation.Nullable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.hypertrace.core.eventsearch.api.Expression;

/** What a function produces. Exactly one kind per function. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Emission {
  Kind kind;
  ExpressionTemplate template;

  /** Only for {@link Kind#CONDITIONAL_TRANSFORM}: picks {@link #template} when it has a value. */
  @Nullable String conditionArgument;

  @Nullable ExpressionTemplate fallbackTemplate;

  /** Output name used when the caller did not give one. */
  @Nullable String fixedAlias;

  public enum Kind {
    /** A per row expression, selected and grouped by like a column. */
    COLUMN,
    AGGREGATE,
    TRANSFORM,
    CONDITIONAL_TRANSFORM
  }

  public static Emission column(String template) {
    return new Emission(Kind.COLUMN, TemplateParser.parse(template), null, null, null);
  }

  public static Emission aggregate(String template) {
    return aggregate(template, null);
  }

  public static Emission aggregate(String template, @Nullable String fixedAlias) {
    return new Emission(Kind.AGGREGATE, TemplateParser.parse(template), null, null, fixedAlias);
  }

  public static Emission transform(String template) {
    return new Emission(Kind.TRANSFORM, TemplateParser.parse(template), null, null, null);
  }

  public static Emission conditionalTransform(
      String conditionArgument, String matchTemplate, String fallbackTemplate) {
    return new Emission(
        Kind.CONDITIONAL_TRANSFORM,
        TemplateParser.parse(matchTemplate),
        conditionArgument,
        TemplateParser.parse(fallbackTemplate),
        null);
  }

  public boolean isAggregate() {
    return kind != Kind.COLUMN;
  }

  public Expression render(TemplateBindings bindings) {
    if (kind == Kind.CONDITIONAL_TRANSFORM && !bindings.hasValue(conditionArgument)) {
      return fallbackTemplate.render(bindings);
    }
    return template.render(bindings);
  }

  public Set<String> getPlaceholders() {
    Set<String> names = new HashSet<>();
    template.collectPlaceholders(names);
    if (fallbackTemplate != null) {
      fallbackTemplate.collectPlaceholders(names);
    }
    if (conditionArgument != null) {
      names.add(conditionArgument);
    }
    return names;
  }
}
