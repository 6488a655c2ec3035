package org.hypertrace.core.eventsearch.function;

import static org.hypertrace.core.eventsearch.column.ColumnCatalog.MEASUREMENTS_VALUE;
import static org.hypertrace.core.eventsearch.column.ColumnCatalog.SPAN_OP_BREAKDOWNS_VALUE;
import static org.hypertrace.core.eventsearch.column.ColumnCatalog.TIMESTAMP;
import static org.hypertrace.core.eventsearch.column.ColumnCatalog.TRANSACTION_DURATION;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import org.hypertrace.core.eventsearch.api.ColumnReference;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.FunctionCall;
import org.hypertrace.core.eventsearch.api.Literal;
import org.hypertrace.core.eventsearch.api.ResultType;
import org.hypertrace.core.eventsearch.column.ColumnCatalog;

/** Factory for the closed set of argument kinds functions are declared with. */
public final class FunctionArguments {
  private static final Pattern ALIAS_PATTERN = Pattern.compile("^[a-zA-Z0-9_.]+$");
  private static final Set<String> NUMERIC_COLUMNS =
      ImmutableSet.of("time", TIMESTAMP, TRANSACTION_DURATION);
  private static final Set<String> ARRAY_VALUE_COLUMNS =
      ImmutableSet.of(MEASUREMENTS_VALUE, SPAN_OP_BREAKDOWNS_VALUE);

  /** Conditions a {@link ArgumentKind#CONDITION} argument accepts, in the order they are listed. */
  public static final List<String> VALID_CONDITIONS =
      ImmutableList.of(
          "equals", "notEquals", "lessOrEquals", "greaterOrEquals", "less", "greater");

  private FunctionArguments() {}

  /** Another function's alias, referenced as a column of the same query. */
  public static FunctionArgument aliasReference(String name) {
    return new SimpleArgument(name, ArgumentKind.ALIAS_REFERENCE);
  }

  public static FunctionArgument functionAlias(String name) {
    return new SimpleArgument(name, ArgumentKind.FUNCTION_ALIAS) {
      @Override
      public Object normalize(@Nullable String value, ArgumentContext context) {
        if (value == null || !ALIAS_PATTERN.matcher(value).matches()) {
          throw new IllegalArgumentException(
              String.format("%s is not a valid function alias", value));
        }
        return value;
      }
    };
  }

  /** Accepted and dropped, so {@code count()} and {@code count(id)} mean the same. */
  public static FunctionArgument nullColumn(String name) {
    FunctionArgument argument =
        new SimpleArgument(name, ArgumentKind.NULL_COLUMN) {
          @Override
          public Object normalize(@Nullable String value, ArgumentContext context) {
            return null;
          }
        };
    return argument.withDefault(null);
  }

  /** Any field; virtual fields expand to their expression so they can be counted. */
  public static FunctionArgument countColumn(String name) {
    return new CountColumnArgument(name, ArgumentKind.COUNT_COLUMN).withDefault(null);
  }

  /** Like {@link #countColumn} but typed after the column, for functions such as {@code any}. */
  public static FunctionArgument fieldColumn(String name) {
    return new CountColumnArgument(name, ArgumentKind.FIELD_COLUMN) {
      @Override
      public ResultType getType(@Nullable Object value) {
        if (!(value instanceof String)) {
          return ResultType.STRING;
        }
        String field = (String) value;
        if (TRANSACTION_DURATION.equals(field)
            || ColumnCatalog.isDurationMeasurement(field)
            || ColumnCatalog.isSpanOpBreakdown(field)) {
          return ResultType.DURATION;
        }
        if (TIMESTAMP.equals(field)) {
          return ResultType.DATE;
        }
        return ResultType.STRING;
      }
    }.withDefault(null);
  }

  /** A known column, optionally restricted to an allow list of public names. */
  public static FunctionArgument column(String name, String... allowedColumns) {
    return new ColumnArgument(name, ImmutableSet.copyOf(allowedColumns));
  }

  public static FunctionArgument numericColumn(String name) {
    return new NumericColumnArgument(name, false);
  }

  /** Also accepts the measurement and breakdown value arrays, expanded with {@code arrayJoin}. */
  public static FunctionArgument numericColumnOrArray(String name) {
    return new NumericColumnArgument(name, true);
  }

  public static FunctionArgument durationColumn(String name) {
    return new ColumnBackedArgument(name, ArgumentKind.DURATION_COLUMN) {
      @Override
      public Object normalize(@Nullable String value, ArgumentContext context) {
        String field = requireValue(value);
        if (ColumnCatalog.isDurationMeasurement(field) || ColumnCatalog.isSpanOpBreakdown(field)) {
          return field;
        }
        if (!context.getColumnCatalog().isKnownColumn(field)) {
          throw new IllegalArgumentException(String.format("%s is not a valid column", field));
        }
        if (!TRANSACTION_DURATION.equals(field)) {
          throw new IllegalArgumentException(String.format("%s is not a duration column", field));
        }
        return field;
      }

      @Override
      public ResultType getType(@Nullable Object value) {
        return ResultType.DURATION;
      }
    };
  }

  public static FunctionArgument stringArrayColumn(String name) {
    return new SimpleArgument(name, ArgumentKind.STRING_ARRAY_COLUMN) {
      @Override
      public Object normalize(@Nullable String value, ArgumentContext context) {
        if (value == null || !ColumnCatalog.isStringArrayColumn(value)) {
          throw new IllegalArgumentException(
              String.format("%s is not a valid string array column", value));
        }
        return value;
      }

      @Override
      public Expression toExpression(@Nullable Object value, ArgumentContext context) {
        return ColumnReference.of((String) value);
      }
    };
  }

  public static FunctionArgument string(String name) {
    return new StringArgument(name, false, false);
  }

  /** A double quoted string; {@code \"} inside it stands for a quote. */
  public static FunctionArgument quotedString(String name) {
    return new StringArgument(name, true, true);
  }

  public static FunctionArgument date(String name) {
    return new SimpleArgument(name, ArgumentKind.DATE) {
      private final DateTimeFormatter format = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

      @Override
      public Object normalize(@Nullable String value, ArgumentContext context) {
        try {
          LocalDateTime.parse(requireValue(value), format);
        } catch (DateTimeParseException e) {
          throw new IllegalArgumentException(
              String.format(
                  "%s is in the wrong format, expected a date like 2020-03-14T15:14:15", value));
        }
        return value;
      }
    };
  }

  public static FunctionArgument condition(String name) {
    return new SimpleArgument(name, ArgumentKind.CONDITION) {
      @Override
      public Object normalize(@Nullable String value, ArgumentContext context) {
        if (!VALID_CONDITIONS.contains(value)) {
          throw new IllegalArgumentException(
              String.format(
                  "%s is not a valid condition, the only supported conditions are: %s",
                  value, String.join(",", VALID_CONDITIONS)));
        }
        return value;
      }
    };
  }

  /** A number in {@code [start, end)}; either bound may be absent. */
  public static FunctionArgument numberRange(
      String name, @Nullable Double start, @Nullable Double end) {
    return new NumberRangeArgument(name, ArgumentKind.NUMBER_RANGE, start, end);
  }

  /** Same as {@link #numberRange} but an empty value normalizes to null. Defaults to null. */
  public static FunctionArgument nullableNumberRange(
      String name, @Nullable Double start, @Nullable Double end) {
    return new NumberRangeArgument(name, ArgumentKind.NULLABLE_NUMBER_RANGE, start, end) {
      @Override
      public Object normalize(@Nullable String value, ArgumentContext context) {
        if (value == null || value.isEmpty()) {
          return null;
        }
        return super.normalize(value, context);
      }
    }.withDefault(null);
  }

  /** A number that defaults to the length of the requested time window, in seconds. */
  public static FunctionArgument intervalDefault(
      String name, @Nullable Double start, @Nullable Double end) {
    NumberRangeArgument argument =
        new NumberRangeArgument(name, ArgumentKind.INTERVAL_DEFAULT, start, end) {
          @Override
          public String getDefault(ArgumentContext context) {
            return context
                .getParams()
                .getInterval()
                .map(interval -> String.valueOf(interval.getSeconds()))
                .orElseThrow(
                    () -> new IllegalArgumentException("function called without default"));
          }
        };
    argument.markDefaulted();
    return argument;
  }

  static String requireValue(@Nullable String value) {
    if (value == null) {
      throw new IllegalArgumentException("a column is required");
    }
    return value;
  }

  private static class SimpleArgument extends FunctionArgument {
    private final ArgumentKind kind;

    SimpleArgument(String name, ArgumentKind kind) {
      super(name);
      this.kind = kind;
    }

    @Override
    public ArgumentKind getKind() {
      return kind;
    }

    @Override
    public Expression toExpression(@Nullable Object value, ArgumentContext context) {
      if (kind == ArgumentKind.ALIAS_REFERENCE || kind == ArgumentKind.FUNCTION_ALIAS) {
        return ColumnReference.of((String) value);
      }
      return super.toExpression(value, context);
    }
  }

  /** Normalizes to the public field name; the template sees the resolved field expression. */
  private abstract static class ColumnBackedArgument extends SimpleArgument {

    ColumnBackedArgument(String name, ArgumentKind kind) {
      super(name, kind);
    }

    @Override
    public Expression toExpression(@Nullable Object value, ArgumentContext context) {
      if (value instanceof String) {
        return context.resolveField((String) value);
      }
      return super.toExpression(value, context);
    }
  }

  private static class CountColumnArgument extends ColumnBackedArgument {

    CountColumnArgument(String name, ArgumentKind kind) {
      super(name, kind);
    }

    @Override
    public Object normalize(@Nullable String value, ArgumentContext context) {
      String field = requireValue(value);
      Optional<Expression> alias = context.resolveFieldAlias(field);
      if (alias.isPresent()) {
        return stripAlias(alias.get());
      }
      return field;
    }

    private static Expression stripAlias(Expression expression) {
      if (expression instanceof FunctionCall) {
        return ((FunctionCall) expression).withAlias(null);
      }
      if (expression instanceof ColumnReference) {
        return ColumnReference.of(((ColumnReference) expression).getName());
      }
      return expression;
    }
  }

  private static class ColumnArgument extends ColumnBackedArgument {
    private final Set<String> allowedColumns;

    ColumnArgument(String name, Set<String> allowedColumns) {
      super(name, ArgumentKind.COLUMN);
      this.allowedColumns = allowedColumns;
    }

    @Override
    public Object normalize(@Nullable String value, ArgumentContext context) {
      String field = requireValue(value);
      if (!allowedColumns.isEmpty()) {
        if (!allowedColumns.contains(field)) {
          throw new IllegalArgumentException(String.format("%s is not an allowed column", field));
        }
        return field;
      }
      if (!context.getColumnCatalog().isKnownColumn(field)) {
        throw new IllegalArgumentException(String.format("%s is not a valid column", field));
      }
      return field;
    }
  }

  private static class NumericColumnArgument extends ColumnBackedArgument {
    private final boolean allowArrayValue;

    NumericColumnArgument(String name, boolean allowArrayValue) {
      super(name, ArgumentKind.NUMERIC_COLUMN);
      this.allowArrayValue = allowArrayValue;
    }

    @Override
    public Object normalize(@Nullable String value, ArgumentContext context) {
      String field = requireValue(value);
      if (allowArrayValue && ARRAY_VALUE_COLUMNS.contains(field)) {
        return FunctionCall.of("arrayJoin", ColumnReference.of(field));
      }
      if (ColumnCatalog.isMeasurement(field) || ColumnCatalog.isSpanOpBreakdown(field)) {
        return field;
      }
      if (!context.getColumnCatalog().isKnownColumn(field)) {
        throw new IllegalArgumentException(String.format("%s is not a valid column", field));
      }
      if (!NUMERIC_COLUMNS.contains(field)) {
        throw new IllegalArgumentException(String.format("%s is not a numeric column", field));
      }
      return field;
    }

    @Override
    public ResultType getType(@Nullable Object value) {
      if (!(value instanceof String)) {
        return ResultType.NUMBER;
      }
      String field = (String) value;
      if (TRANSACTION_DURATION.equals(field)
          || ColumnCatalog.isDurationMeasurement(field)
          || ColumnCatalog.isSpanOpBreakdown(field)) {
        return ResultType.DURATION;
      }
      if (TIMESTAMP.equals(field)) {
        return ResultType.DATE;
      }
      return ResultType.NUMBER;
    }
  }

  private static class StringArgument extends SimpleArgument {
    private final boolean unquote;
    private final boolean unescapeQuotes;

    StringArgument(String name, boolean unquote, boolean unescapeQuotes) {
      super(name, ArgumentKind.STRING);
      this.unquote = unquote;
      this.unescapeQuotes = unescapeQuotes;
    }

    @Override
    public Object normalize(@Nullable String value, ArgumentContext context) {
      String text = value == null ? "" : value;
      if (unquote) {
        if (text.length() < 2 || text.charAt(0) != '"' || text.charAt(text.length() - 1) != '"') {
          throw new IllegalArgumentException("string should be quoted");
        }
        text = text.substring(1, text.length() - 1);
      }
      if (unescapeQuotes) {
        text = text.replace("\\\"", "\"");
      }
      return text;
    }

    @Override
    public Expression toExpression(@Nullable Object value, ArgumentContext context) {
      return Literal.of(value);
    }
  }

  private static class NumberRangeArgument extends SimpleArgument {
    @Nullable private final Double start;
    @Nullable private final Double end;

    NumberRangeArgument(
        String name, ArgumentKind kind, @Nullable Double start, @Nullable Double end) {
      super(name, kind);
      this.start = start;
      this.end = end;
    }

    @Override
    public Object normalize(@Nullable String value, ArgumentContext context) {
      double number;
      try {
        number = Double.parseDouble(requireNumber(value));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(String.format("%s is not a number", value));
      }
      if (start != null && number < start) {
        throw new IllegalArgumentException(
            String.format(
                "%s must be greater than or equal to %s",
                NameFormatter.formatGeneral(number),
                NameFormatter.formatGeneral(start)));
      }
      if (end != null && number >= end) {
        throw new IllegalArgumentException(
            String.format(
                "%s must be less than %s",
                NameFormatter.formatGeneral(number),
                NameFormatter.formatGeneral(end)));
      }
      return number;
    }

    @Override
    public ResultType getType(@Nullable Object value) {
      return ResultType.NUMBER;
    }

    private static String requireNumber(@Nullable String value) {
      if (value == null) {
        throw new NumberFormatException();
      }
      return value.trim();
    }
  }
}
