package org.hypertrace.core.eventsearch.function;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads templates written in call syntax, for example {@code divide(count(), {interval})} or
 * {@code quantile({percentile:g})({column})}.
 *
 * <ul>
 *   <li>{@code name(args)} is a call; a second argument list makes the first one part of the name
 *   <li>{@code {name}} is an argument placeholder, any format spec only applies inside names
 *   <li>{@code 'text'}, integers, decimals and {@code null} are constants
 *   <li>any other bare word is a public field
 * </ul>
 */
public class TemplateParser {
  private final String text;
  private int position;

  private TemplateParser(String text) {
    this.text = text;
  }

  /**
   * @throws IllegalStateException when the template is malformed, templates are only parsed while
   *     the registry is built
   */
  public static ExpressionTemplate parse(String text) {
    TemplateParser parser = new TemplateParser(text);
    ExpressionTemplate template = parser.expression();
    parser.skipWhitespace();
    if (parser.position != text.length()) {
      throw parser.error("unexpected trailing input");
    }
    return template;
  }

  private ExpressionTemplate expression() {
    skipWhitespace();
    if (atEnd()) {
      throw error("expression expected");
    }
    char c = peek();
    if (c == '\'') {
      return ExpressionTemplate.constant(quoted());
    }
    if (Character.isDigit(c) || (c == '-' && position + 1 < text.length()
        && Character.isDigit(text.charAt(position + 1)))) {
      return ExpressionTemplate.constant(number());
    }
    boolean placeholder = c == '{';
    String name = placeholder ? placeholder() : word();
    skipWhitespace();
    if (!atEnd() && peek() == '(') {
      return call(name);
    }
    if (placeholder) {
      String inner = name.substring(1, name.length() - 1);
      int spec = inner.indexOf(':');
      return ExpressionTemplate.argument(spec < 0 ? inner : inner.substring(0, spec));
    }
    if ("null".equals(name)) {
      return ExpressionTemplate.constant(null);
    }
    return ExpressionTemplate.field(name);
  }

  private ExpressionTemplate call(String name) {
    int open = position;
    List<ExpressionTemplate> arguments = argumentList();
    skipWhitespace();
    if (!atEnd() && peek() == '(') {
      // parametric aggregate, the first list is part of the function name
      String parameters = text.substring(open, position).replaceAll("\\s+", "");
      return ExpressionTemplate.call(name + parameters, argumentList());
    }
    return ExpressionTemplate.call(name, arguments);
  }

  private List<ExpressionTemplate> argumentList() {
    expect('(');
    List<ExpressionTemplate> arguments = new ArrayList<>();
    skipWhitespace();
    if (!atEnd() && peek() == ')') {
      position++;
      return arguments;
    }
    while (true) {
      arguments.add(expression());
      skipWhitespace();
      if (atEnd()) {
        throw error("unclosed argument list");
      }
      char c = text.charAt(position++);
      if (c == ')') {
        return arguments;
      }
      if (c != ',') {
        throw error("',' or ')' expected");
      }
    }
  }

  private String placeholder() {
    int start = position;
    int end = text.indexOf('}', start);
    if (end < 0) {
      throw error("unclosed placeholder");
    }
    position = end + 1;
    return text.substring(start, position);
  }

  private String word() {
    int start = position;
    while (!atEnd() && isWordChar(peek())) {
      position++;
    }
    if (start == position) {
      throw error("name expected");
    }
    return text.substring(start, position);
  }

  private String quoted() {
    expect('\'');
    StringBuilder value = new StringBuilder();
    while (!atEnd()) {
      char c = text.charAt(position++);
      if (c == '\\' && !atEnd()) {
        value.append(text.charAt(position++));
      } else if (c == '\'') {
        return value.toString();
      } else {
        value.append(c);
      }
    }
    throw error("unclosed string");
  }

  private Number number() {
    int start = position;
    position++;
    while (!atEnd() && (Character.isDigit(peek()) || peek() == '.')) {
      position++;
    }
    String literal = text.substring(start, position);
    return literal.contains(".") ? (Number) Double.valueOf(literal) : (Number) Long.valueOf(literal);
  }

  private static boolean isWordChar(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '.';
  }

  private void expect(char expected) {
    skipWhitespace();
    if (atEnd() || peek() != expected) {
      throw error(String.format("'%s' expected", expected));
    }
    position++;
  }

  private void skipWhitespace() {
    while (!atEnd() && Character.isWhitespace(peek())) {
      position++;
    }
  }

  private boolean atEnd() {
    return position >= text.length();
  }

  private char peek() {
    return text.charAt(position);
  }

  private IllegalStateException error(String message) {
    return new IllegalStateException(
        String.format("Invalid template '%s' at %d: %s", text, position, message));
  }
}
