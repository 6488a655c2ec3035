package org.hypertrace.core.eventsearch.api;

import javax.annotation.Nullable;

/**
 * Node of the expression tree handed to the execution layer. The tree is closed over three kinds:
 * column references, literals and function calls.
 */
public interface Expression {

  ExpressionCase getExpressionCase();

  /** Output name of the expression, when it is selected. */
  @Nullable
  String getAlias();

  enum ExpressionCase {
    COLUMN,
    LITERAL,
    FUNCTION
  }
}
