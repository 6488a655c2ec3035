package org.hypertrace.core.eventsearch.function;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/**
 * Formats the text of parametric function names such as {@code quantile({percentile:g})}.
 * Supported specs are none, {@code g} (six significant digits, trailing zeros dropped) and {@code
 * .Nf} (fixed point with N decimals).
 */
public final class NameFormatter {
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)(?::([^}]*))?}");
  private static final Pattern FIXED_POINT = Pattern.compile("^\\.(\\d+)f$");
  private static final MathContext GENERAL_PRECISION = new MathContext(6);

  private NameFormatter() {}

  public static String format(String template, Map<String, Object> values) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    StringBuilder result = new StringBuilder();
    while (matcher.find()) {
      String name = matcher.group(1);
      if (!values.containsKey(name)) {
        throw new IllegalArgumentException(String.format("No value for placeholder %s", name));
      }
      matcher.appendReplacement(
          result, Matcher.quoteReplacement(formatValue(values.get(name), matcher.group(2))));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  public static boolean hasPlaceholders(String template) {
    return PLACEHOLDER.matcher(template).find();
  }

  static void collectPlaceholders(String template, Set<String> names) {
    Matcher matcher = PLACEHOLDER.matcher(template);
    while (matcher.find()) {
      names.add(matcher.group(1));
    }
  }

  static String formatValue(@Nullable Object value, @Nullable String spec) {
    if (spec == null || spec.isEmpty()) {
      return String.valueOf(value);
    }
    if (!(value instanceof Number)) {
      throw new IllegalArgumentException(
          String.format("Format %s needs a number, got %s", spec, value));
    }
    double number = ((Number) value).doubleValue();
    if ("g".equals(spec)) {
      return formatGeneral(number);
    }
    Matcher fixed = FIXED_POINT.matcher(spec);
    if (fixed.matches()) {
      return String.format(Locale.ROOT, "%." + fixed.group(1) + "f", number);
    }
    throw new IllegalArgumentException(String.format("Unsupported format %s", spec));
  }

  /** Six significant digits; scientific notation below 1e-4 and from 1e6 on. */
  public static String formatGeneral(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return Double.isNaN(value) ? "nan" : (value > 0 ? "inf" : "-inf");
    }
    if (value == 0) {
      return "0";
    }
    BigDecimal rounded = new BigDecimal(value).round(GENERAL_PRECISION);
    int exponent = rounded.precision() - rounded.scale() - 1;
    if (exponent < -4 || exponent >= 6) {
      String mantissa = rounded.movePointLeft(exponent).stripTrailingZeros().toPlainString();
      return String.format(
          Locale.ROOT, "%se%s%02d", mantissa, exponent < 0 ? "-" : "+", Math.abs(exponent));
    }
    return rounded.stripTrailingZeros().toPlainString();
  }
}
