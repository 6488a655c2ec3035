package org.hypertrace.core.eventsearch.column;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.UNKNOWN_FIELD;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.EventSearchConfig;
import org.hypertrace.core.eventsearch.api.ColumnReference;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.ResultType;

/**
 * Maps public field names to the columns of the events table. Fields that are neither known
 * columns, measurements nor span operation breakdowns are looked up as tags.
 */
@Singleton
public class ColumnCatalog {
  public static final String TIMESTAMP = "timestamp";
  public static final String PROJECT_ID = "project.id";
  public static final String ISSUE_ID = "issue.id";
  public static final String ENVIRONMENT = "environment";
  public static final String TRANSACTION_DURATION = "transaction.duration";

  static final String MEASUREMENTS_PREFIX = "measurements.";
  static final String SPAN_OP_BREAKDOWNS_PREFIX = "spans.";
  public static final String MEASUREMENTS_VALUE = "measurements_value";
  public static final String SPAN_OP_BREAKDOWNS_VALUE = "span_op_breakdowns_value";

  private static final Pattern TAG_KEY_PATTERN = Pattern.compile("^tags\\[(?<tag>.*)]$");
  private static final Pattern VALID_FIELD_PATTERN = Pattern.compile("^[a-zA-Z0-9_.:-]*$");

  private static final Set<String> DURATION_MEASUREMENTS =
      ImmutableSet.of(
          "fp", "fcp", "lcp", "fid", "ttfb", "ttfb.requesttime", "app_start_cold",
          "app_start_warm", "time_to_initial_display", "time_to_full_display");

  private static final Set<String> STRING_ARRAY_COLUMNS =
      ImmutableSet.of("tags.key", "tags.value", "measurements_key", "span_op_breakdowns_key");

  private static final ImmutableMap<String, String> FIELD_TO_COLUMN =
      ImmutableMap.<String, String>builder()
          .put("id", "event_id")
          .put(PROJECT_ID, "project_id")
          .put(ISSUE_ID, "group_id")
          .put(TIMESTAMP, "timestamp")
          .put("time", "time")
          .put("message", "message")
          .put("title", "title")
          .put(ENVIRONMENT, "environment")
          .put("release", "release")
          .put("dist", "dist")
          .put("platform", "platform")
          .put("event.type", "type")
          .put("location", "location")
          .put("culprit", "culprit")
          .put("transaction", "transaction_name")
          .put("transaction.op", "transaction_op")
          .put("transaction.status", "transaction_status")
          .put(TRANSACTION_DURATION, "duration")
          .put("user", "user")
          .put("user.id", "user_id")
          .put("user.email", "email")
          .put("user.username", "username")
          .put("user.ip", "ip_address")
          .put("http.method", "http_method")
          .put("http.url", "http_url")
          .put("http.status_code", "http_status_code")
          .put("sdk.name", "sdk_name")
          .put("sdk.version", "sdk_version")
          .put("geo.country_code", "geo_country_code")
          .put("geo.city", "geo_city")
          .put("trace", "trace_id")
          .put("trace.span", "span_id")
          .put("trace.parent_span", "contexts[trace.parent_span_id]")
          .put("error.type", "exception_stacks.type")
          .put("error.value", "exception_stacks.value")
          .put("error.mechanism", "exception_stacks.mechanism_type")
          .put("error.handled", "exception_stacks.mechanism_handled")
          .put("stack.abs_path", "exception_frames.abs_path")
          .put("stack.filename", "exception_frames.filename")
          .put("stack.package", "exception_frames.package")
          .put("stack.module", "exception_frames.module")
          .put("stack.function", "exception_frames.function")
          .put("stack.in_app", "exception_frames.in_app")
          .put("stack.colno", "exception_frames.colno")
          .put("stack.lineno", "exception_frames.lineno")
          .put("stack.stack_level", "exception_frames.stack_level")
          .put("contexts.key", "contexts.key")
          .put("contexts.value", "contexts.value")
          .build();

  private final Set<String> arrayFields;

  @Inject
  public ColumnCatalog(EventSearchConfig config) {
    this.arrayFields = ImmutableSet.copyOf(config.getArrayColumns());
  }

  public Optional<String> getStorageColumn(String field) {
    return Optional.ofNullable(FIELD_TO_COLUMN.get(field));
  }

  public boolean isKnownColumn(String field) {
    return FIELD_TO_COLUMN.containsKey(field);
  }

  public ColumnCapability getCapability(String field) {
    return arrayFields.contains(field) ? ColumnCapability.ARRAY : ColumnCapability.SCALAR;
  }

  public static boolean isMeasurement(String field) {
    return field.startsWith(MEASUREMENTS_PREFIX);
  }

  public static boolean isDurationMeasurement(String field) {
    return isMeasurement(field)
        && DURATION_MEASUREMENTS.contains(field.substring(MEASUREMENTS_PREFIX.length()));
  }

  public static boolean isSpanOpBreakdown(String field) {
    return field.startsWith(SPAN_OP_BREAKDOWNS_PREFIX);
  }

  public static boolean isStringArrayColumn(String column) {
    return STRING_ARRAY_COLUMNS.contains(column);
  }

  /** Explicit {@code tags[x]} keys and fields not backed by a column. */
  public boolean isTag(String field) {
    return TAG_KEY_PATTERN.matcher(field).matches()
        || (!isKnownColumn(field) && !isMeasurement(field) && !isSpanOpBreakdown(field));
  }

  public static boolean isTagColumn(Expression expression) {
    return expression instanceof ColumnReference
        && ((ColumnReference) expression).getName().startsWith("tags[");
  }

  /**
   * Column reference for a public field.
   *
   * @throws InvalidSearchQueryException when the name contains characters a field cannot have
   */
  public ColumnReference resolve(String field) {
    String column = FIELD_TO_COLUMN.get(field);
    if (column != null) {
      return ColumnReference.of(column);
    }
    if (isMeasurement(field)) {
      return ColumnReference.of(
          String.format("measurements[%s]", field.substring(MEASUREMENTS_PREFIX.length())));
    }
    if (isSpanOpBreakdown(field)) {
      return ColumnReference.of(
          String.format(
              "span_op_breakdowns[ops.%s]", field.substring(SPAN_OP_BREAKDOWNS_PREFIX.length())));
    }
    Matcher tagMatcher = TAG_KEY_PATTERN.matcher(field);
    if (tagMatcher.matches()) {
      return ColumnReference.of(String.format("tags[%s]", tagMatcher.group("tag")));
    }
    if (!VALID_FIELD_PATTERN.matcher(field).matches()) {
      throw new InvalidSearchQueryException(
          UNKNOWN_FIELD, String.format("Invalid characters in field %s", field));
    }
    return ColumnReference.of(String.format("tags[%s]", field));
  }

  /** Semantic type of a field when selected as is. */
  public ResultType getResultType(String field) {
    if (TRANSACTION_DURATION.equals(field)
        || isDurationMeasurement(field)
        || isSpanOpBreakdown(field)) {
      return ResultType.DURATION;
    }
    if (TIMESTAMP.equals(field) || "time".equals(field)) {
      return ResultType.DATE;
    }
    if (isMeasurement(field)) {
      return ResultType.NUMBER;
    }
    if (PROJECT_ID.equals(field) || ISSUE_ID.equals(field)) {
      return ResultType.INTEGER;
    }
    return ResultType.STRING;
  }
}
