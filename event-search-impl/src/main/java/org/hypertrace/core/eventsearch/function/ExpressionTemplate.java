package org.hypertrace.core.eventsearch.function;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import lombok.EqualsAndHashCode;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.FunctionCall;
import org.hypertrace.core.eventsearch.api.Literal;

/**
 * Output shape of a function with placeholders for its arguments. Rendering substitutes the
 * normalized argument values; names of calls may carry placeholders too, for parametric
 * aggregates.
 */
public abstract class ExpressionTemplate {

  public abstract Expression render(TemplateBindings bindings);

  /** Names of every argument the template refers to. */
  public abstract void collectPlaceholders(Set<String> names);

  public static ExpressionTemplate call(String name, List<ExpressionTemplate> arguments) {
    return new CallTemplate(name, List.copyOf(arguments));
  }

  public static ExpressionTemplate call(String name, ExpressionTemplate... arguments) {
    return new CallTemplate(name, List.of(arguments));
  }

  public static ExpressionTemplate argument(String name) {
    return new ArgumentTemplate(name);
  }

  public static ExpressionTemplate constant(@Nullable Object value) {
    return new ConstantTemplate(value);
  }

  /** A public field, resolved through field aliases and the column catalog at render time. */
  public static ExpressionTemplate field(String name) {
    return new FieldTemplate(name);
  }

  @EqualsAndHashCode(callSuper = false)
  static class CallTemplate extends ExpressionTemplate {
    private final String name;
    private final List<ExpressionTemplate> arguments;

    CallTemplate(String name, List<ExpressionTemplate> arguments) {
      this.name = name;
      this.arguments = arguments;
    }

    @Override
    public Expression render(TemplateBindings bindings) {
      return FunctionCall.of(
          bindings.formatName(name),
          arguments.stream()
              .map(argument -> argument.render(bindings))
              .collect(Collectors.toList()));
    }

    @Override
    public void collectPlaceholders(Set<String> names) {
      NameFormatter.collectPlaceholders(name, names);
      arguments.forEach(argument -> argument.collectPlaceholders(names));
    }

    @Override
    public String toString() {
      return name
          + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
  }

  @EqualsAndHashCode(callSuper = false)
  static class ArgumentTemplate extends ExpressionTemplate {
    private final String name;

    ArgumentTemplate(String name) {
      this.name = name;
    }

    @Override
    public Expression render(TemplateBindings bindings) {
      return bindings.expressionOf(name);
    }

    @Override
    public void collectPlaceholders(Set<String> names) {
      names.add(name);
    }

    @Override
    public String toString() {
      return "{" + name + "}";
    }
  }

  @EqualsAndHashCode(callSuper = false)
  static class ConstantTemplate extends ExpressionTemplate {
    @Nullable private final Object value;

    ConstantTemplate(@Nullable Object value) {
      this.value = value;
    }

    @Override
    public Expression render(TemplateBindings bindings) {
      return Literal.of(value);
    }

    @Override
    public void collectPlaceholders(Set<String> names) {}

    @Override
    public String toString() {
      return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
  }

  @EqualsAndHashCode(callSuper = false)
  static class FieldTemplate extends ExpressionTemplate {
    private final String field;

    FieldTemplate(String field) {
      this.field = field;
    }

    @Override
    public Expression render(TemplateBindings bindings) {
      return bindings.resolveField(field);
    }

    @Override
    public void collectPlaceholders(Set<String> names) {}

    @Override
    public String toString() {
      return field;
    }
  }
}
