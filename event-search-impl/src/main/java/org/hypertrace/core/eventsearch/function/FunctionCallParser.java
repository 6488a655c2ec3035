package org.hypertrace.core.eventsearch.function;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/** Splits field text such as {@code p95(transaction.duration) AS slow} into its parts. */
public final class FunctionCallParser {
  private static final Pattern FUNCTION_PATTERN =
      Pattern.compile("^(?<function>[^(]+)\\((?<columns>.*)\\)( (as|AS) (?<alias>\\S+))?$");
  private static final Pattern NON_WORD =
      Pattern.compile("[^\\w]", Pattern.UNICODE_CHARACTER_CLASS);

  /** Functions whose arguments may be quoted strings containing commas. */
  private static final String QUOTED_ARGUMENT_FUNCTION = "to_other";

  private FunctionCallParser() {}

  public static boolean isFunction(String field) {
    return FUNCTION_PATTERN.matcher(field).matches();
  }

  public static Optional<ParsedFunction> parse(String field) {
    Matcher matcher = FUNCTION_PATTERN.matcher(field);
    if (!matcher.matches()) {
      return Optional.empty();
    }
    String name = matcher.group("function");
    return Optional.of(
        new ParsedFunction(
            field, name, parseArguments(name, matcher.group("columns")), matcher.group("alias")));
  }

  /** The output name of a field: its explicit alias, the derived function alias or itself. */
  public static String getFunctionAlias(String field) {
    return parse(field).map(ParsedFunction::getOutputAlias).orElse(field);
  }

  /** {@code count_unique(user.id)} becomes {@code count_unique_user_id}. */
  public static String deriveAlias(String name, List<String> arguments) {
    String columns = NON_WORD.matcher(String.join("_", arguments)).replaceAll("_");
    return StringUtils.stripEnd(name + "_" + columns, "_");
  }

  static List<String> parseArguments(String function, String columns) {
    if (!QUOTED_ARGUMENT_FUNCTION.equals(function)) {
      return Arrays.stream(columns.split(",", -1))
          .map(String::trim)
          .filter(column -> !column.isEmpty())
          .collect(Collectors.toList());
    }

    List<String> arguments = new ArrayList<>();
    boolean quoted = false;
    boolean escaped = false;
    int start = 0;
    for (int i = 0; i < columns.length(); i++) {
      char c = columns.charAt(i);
      if (!quoted && c == '"' && columns.substring(start, i).isBlank()) {
        quoted = true;
      } else if (quoted && !escaped && c == '\\') {
        escaped = true;
      } else if (quoted && !escaped && c == '"') {
        quoted = false;
      } else if (quoted && escaped) {
        escaped = false;
      } else if (!quoted && c == ',') {
        arguments.add(columns.substring(start, i).trim());
        start = i + 1;
      }
    }
    if (start != columns.length()) {
      arguments.add(columns.substring(start).trim());
    }
    return arguments.stream().filter(argument -> !argument.isEmpty()).collect(Collectors.toList());
  }

  @Value
  public static class ParsedFunction {
    String field;
    String name;
    List<String> arguments;
    @Nullable String alias;

    public String getOutputAlias() {
      return alias != null ? alias : deriveAlias(name, arguments);
    }
  }
}
