package org.hypertrace.core.eventsearch.function;

import java.util.Map;
import org.hypertrace.core.eventsearch.api.ColumnReference;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.FunctionCall;
import org.hypertrace.core.eventsearch.api.Literal;

/** Normalized argument values of one function call, as seen by its templates. */
public class TemplateBindings {
  private final Map<String, FunctionArgument> arguments;
  private final Map<String, Object> values;
  private final ArgumentContext context;

  public TemplateBindings(
      Map<String, FunctionArgument> arguments, Map<String, Object> values, ArgumentContext context) {
    this.arguments = arguments;
    this.values = values;
    this.context = context;
  }

  public boolean hasValue(String name) {
    return values.get(name) != null;
  }

  Expression expressionOf(String name) {
    if (!values.containsKey(name)) {
      throw new IllegalArgumentException(String.format("No value for argument %s", name));
    }
    Object value = values.get(name);
    FunctionArgument argument = arguments.get(name);
    if (argument != null) {
      return stripAlias(argument.toExpression(value, context));
    }
    return value instanceof Expression ? (Expression) value : Literal.of(value);
  }

  String formatName(String name) {
    return NameFormatter.format(name, values);
  }

  Expression resolveField(String field) {
    return stripAlias(context.resolveField(field));
  }

  private static Expression stripAlias(Expression expression) {
    if (expression.getAlias() == null) {
      return expression;
    }
    if (expression instanceof FunctionCall) {
      return ((FunctionCall) expression).withAlias(null);
    }
    if (expression instanceof ColumnReference) {
      return ColumnReference.of(((ColumnReference) expression).getName());
    }
    return expression;
  }
}
