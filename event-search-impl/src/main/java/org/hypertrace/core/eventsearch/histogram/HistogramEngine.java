package org.hypertrace.core.eventsearch.histogram;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.INVALID_ARGUMENT;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.columnCondition;

import com.google.common.math.LongMath;
import io.reactivex.rxjava3.core.Single;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.EventSearchConfig;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.QueryPlan;
import org.hypertrace.core.eventsearch.api.spi.QueryExecutor;
import org.hypertrace.core.eventsearch.api.spi.QueryResult;
import org.hypertrace.core.eventsearch.column.ColumnCatalog;
import org.hypertrace.core.eventsearch.function.FunctionCallParser;
import org.hypertrace.core.eventsearch.plan.EventSearchCompiler;
import org.hypertrace.core.eventsearch.plan.SearchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Histograms of numeric fields. Bucket widths are "nice" numbers, 1, 2, 2.5 or 5 times a power of
 * ten, and the buckets are aligned on multiples of the width.
 *
 * <p>Several measurements, or several span operation breakdowns, are counted in one query over
 * the array of values, grouped by key.
 */
@Singleton
public class HistogramEngine {
  private static final Logger LOG = LoggerFactory.getLogger(HistogramEngine.class);

  static final String HISTOGRAM_FUNCTION = "histogram";
  static final String ARRAY_JOIN_FUNCTION = "array_join";
  static final String COUNT_FIELD = "count()";
  static final int MAX_PRECISION = 4;

  private static final double[] NICE_MANTISSAS = {1, 2, 2.5, 5, 10};

  private final EventSearchCompiler compiler;
  private final QueryExecutor executor;
  private final int maxHistogramBuckets;

  @Inject
  public HistogramEngine(
      EventSearchCompiler compiler, QueryExecutor executor, EventSearchConfig config) {
    this.compiler = compiler;
    this.executor = executor;
    this.maxHistogramBuckets = config.getLimits().getMaxHistogramBuckets();
  }

  /**
   * Counts per bucket for each of {@code fields}, zero filled. Bounds that are not given are
   * queried; when there is no data to derive them from, every field maps to an empty list.
   */
  public Single<Map<String, List<HistogramBucket>>> histogram(
      SearchRequest request,
      List<String> fields,
      int numBuckets,
      int precision,
      HistogramBounds requested,
      boolean excludeOutliers) {
    validate(fields, numBuckets, precision);
    Single<HistogramBounds> bounds =
        requested.isComplete()
            ? Single.just(requested)
            : findBounds(request, fields, excludeOutliers).map(requested::orElse);
    return bounds.flatMap(
        resolved -> {
          if (!resolved.isComplete()) {
            return Single.just(emptyResult(fields));
          }
          HistogramParams params =
              computeBuckets(numBuckets, resolved.getMin(), resolved.getMax(), precision);
          return compiler
              .compilePlan(histogramRequest(request, fields, params))
              .map(plan -> withBucketRange(plan, fields, params))
              .flatMap(executor::execute)
              .map(result -> normalize(fields, result, params));
        });
  }

  /**
   * Bucketing covering {@code [min, max]} with at most {@code numBuckets} buckets. Unknown bounds
   * yield a single unit wide bucket layout starting at zero.
   */
  public HistogramParams computeBuckets(
      int numBuckets, @Nullable Double min, @Nullable Double max, int precision) {
    long multiplier = LongMath.pow(10, precision);
    if (min == null || max == null) {
      return new HistogramParams(numBuckets, 1, 0, multiplier);
    }
    double scaledMin = min * multiplier;
    double scaledMax = max * multiplier;

    long bucketSize = niceInt((scaledMax - scaledMin) / numBuckets);
    long startOffset = alignedOffset(scaledMin, bucketSize);
    // the upper edge is exclusive, the maximum has to fall inside the last bucket
    while (startOffset + bucketSize * numBuckets <= scaledMax) {
      bucketSize = niceInt(bucketSize + 1);
      startOffset = alignedOffset(scaledMin, bucketSize);
    }
    int neededBuckets = (int) Math.floor((scaledMax - startOffset) / bucketSize) + 1;
    return new HistogramParams(neededBuckets, bucketSize, startOffset, multiplier);
  }

  /** Smallest nice number greater than or equal to {@code value}, at least 1. */
  static long niceInt(double value) {
    if (value <= 1) {
      return 1;
    }
    int exponent = (int) Math.floor(Math.log10(value));
    double scale = Math.pow(10, exponent);
    for (double mantissa : NICE_MANTISSAS) {
      double candidate = mantissa * scale;
      if (candidate == Math.rint(candidate) && candidate >= value) {
        return (long) candidate;
      }
    }
    return (long) (10 * scale);
  }

  private static long alignedOffset(double scaledMin, long bucketSize) {
    return (long) Math.floor(scaledMin / bucketSize) * bucketSize;
  }

  /**
   * Minimum and maximum over all {@code fields}. Excluding outliers caps the maximum at the upper
   * fence {@code Q3 + 3 * IQR}.
   */
  public Single<HistogramBounds> findBounds(
      SearchRequest request, List<String> fields, boolean excludeOutliers) {
    List<String> selected = new ArrayList<>();
    for (String field : fields) {
      selected.add(minField(field));
      selected.add(maxField(field));
      if (excludeOutliers) {
        selected.add(quartileField(field, "0.25"));
        selected.add(quartileField(field, "0.75"));
      }
    }
    SearchRequest boundsRequest =
        request.toBuilder()
            .clearSelectedFields()
            .selectedFields(selected)
            .clearOrderBy()
            .autoFields(false)
            .limit(1)
            .offset(null)
            .build();
    return compiler
        .compilePlan(boundsRequest)
        .flatMap(executor::execute)
        .map(result -> readBounds(result, fields, excludeOutliers));
  }

  private static HistogramBounds readBounds(
      QueryResult result, List<String> fields, boolean excludeOutliers) {
    if (result.isEmpty()) {
      return HistogramBounds.unknown();
    }
    Map<String, Object> row = result.getRows().get(0);
    Double min = null;
    Double max = null;
    Double fence = null;
    for (String field : fields) {
      min = lowest(min, number(row, minField(field)));
      max = highest(max, number(row, maxField(field)));
      if (excludeOutliers) {
        Double firstQuartile = number(row, quartileField(field, "0.25"));
        Double thirdQuartile = number(row, quartileField(field, "0.75"));
        if (firstQuartile != null && thirdQuartile != null) {
          fence = highest(fence, thirdQuartile + 3 * (thirdQuartile - firstQuartile));
        }
      }
    }
    if (max != null && fence != null && fence < max) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Capping histogram maximum {} at outlier fence {}", max, fence);
      }
      max = fence;
    }
    return HistogramBounds.of(min, max);
  }

  /** Request for the bucket counts: the histogram column, the count and the key, if any. */
  SearchRequest histogramRequest(
      SearchRequest request, List<String> fields, HistogramParams params) {
    String histogramField = histogramField(fields, params);
    SearchRequest.SearchRequestBuilder builder =
        request.toBuilder()
            .clearSelectedFields()
            .clearOrderBy()
            .autoFields(false)
            .functionAcl(HISTOGRAM_FUNCTION)
            .limit(params.getNumBuckets() * fields.size())
            .offset(null);
    if (fields.size() > 1) {
      builder.functionAcl(ARRAY_JOIN_FUNCTION).selectedField(keyField(fields));
    }
    return builder
        .selectedField(histogramField)
        .selectedField(COUNT_FIELD)
        .orderByField(FunctionCallParser.getFunctionAlias(histogramField))
        .build();
  }

  /** Restricts the plan to the bucket range, and to the requested keys for array histograms. */
  QueryPlan withBucketRange(QueryPlan plan, List<String> fields, HistogramParams params) {
    String histogramAlias = FunctionCallParser.getFunctionAlias(histogramField(fields, params));
    QueryPlan.QueryPlanBuilder builder =
        plan.toBuilder()
            .whereCondition(
                columnCondition(histogramAlias, ConditionOperator.GTE, params.getStartOffset()))
            .whereCondition(
                columnCondition(histogramAlias, ConditionOperator.LTE, params.getEnd()));
    if (fields.size() > 1) {
      builder.whereCondition(
          columnCondition(
              FunctionCallParser.getFunctionAlias(keyField(fields)),
              ConditionOperator.IN,
              fields.stream().map(HistogramEngine::arrayKey).collect(Collectors.toList())));
    }
    return builder.build();
  }

  /** Zero filled buckets per field, in the order of {@code fields}. */
  public Map<String, List<HistogramBucket>> normalize(
      List<String> fields, QueryResult result, HistogramParams params) {
    String histogramAlias = FunctionCallParser.getFunctionAlias(histogramField(fields, params));
    String countAlias = FunctionCallParser.getFunctionAlias(COUNT_FIELD);
    String keyAlias =
        fields.size() > 1 ? FunctionCallParser.getFunctionAlias(keyField(fields)) : null;

    Map<String, Map<Long, Long>> counts = new HashMap<>();
    for (Map<String, Object> row : result.getRows()) {
      String field = keyAlias == null ? fields.get(0) : fieldOfKey(fields, row.get(keyAlias));
      Double bucket = number(row, histogramAlias);
      Double count = number(row, countAlias);
      if (field == null || bucket == null || count == null) {
        continue;
      }
      counts
          .computeIfAbsent(field, key -> new HashMap<>())
          .merge(Math.round(bucket), count.longValue(), Long::sum);
    }

    Map<String, List<HistogramBucket>> normalized = new LinkedHashMap<>();
    for (String field : fields) {
      Map<Long, Long> fieldCounts = counts.getOrDefault(field, Map.of());
      List<HistogramBucket> buckets = new ArrayList<>(params.getNumBuckets());
      for (int i = 0; i < params.getNumBuckets(); i++) {
        long bucket = params.getStartOffset() + params.getBucketSize() * i;
        buckets.add(new HistogramBucket(params.getBin(i), fieldCounts.getOrDefault(bucket, 0L)));
      }
      normalized.put(field, buckets);
    }
    return normalized;
  }

  private void validate(List<String> fields, int numBuckets, int precision) {
    if (fields.isEmpty()) {
      throw new InvalidSearchQueryException(
          INVALID_ARGUMENT, "A histogram needs at least one field");
    }
    if (numBuckets < 1 || numBuckets > maxHistogramBuckets) {
      throw new InvalidSearchQueryException(
          INVALID_ARGUMENT,
          String.format(
              "histogram(...) requires a bucket value between 1 and %d, not %d",
              maxHistogramBuckets, numBuckets));
    }
    if (precision < 0 || precision > MAX_PRECISION) {
      throw new InvalidSearchQueryException(
          INVALID_ARGUMENT,
          String.format("precision must be between 0 and %d, not %d", MAX_PRECISION, precision));
    }
    if (fields.size() > 1
        && !fields.stream().allMatch(ColumnCatalog::isMeasurement)
        && !fields.stream().allMatch(ColumnCatalog::isSpanOpBreakdown)) {
      throw new InvalidSearchQueryException(
          INVALID_ARGUMENT,
          String.format(
              "Cannot compute a histogram of %s together, only measurements or only span"
                  + " operation breakdowns can be combined",
              String.join(", ", fields)));
    }
  }

  private static Map<String, List<HistogramBucket>> emptyResult(List<String> fields) {
    Map<String, List<HistogramBucket>> empty = new LinkedHashMap<>();
    fields.forEach(field -> empty.put(field, List.of()));
    return empty;
  }

  static String histogramField(List<String> fields, HistogramParams params) {
    String column;
    if (fields.size() == 1) {
      column = fields.get(0);
    } else {
      column =
          ColumnCatalog.isMeasurement(fields.get(0))
              ? ColumnCatalog.MEASUREMENTS_VALUE
              : ColumnCatalog.SPAN_OP_BREAKDOWNS_VALUE;
    }
    return String.format(
        "histogram(%s, %d, %d, %d)",
        column, params.getBucketSize(), params.getStartOffset(), params.getMultiplier());
  }

  private static String keyField(List<String> fields) {
    return ColumnCatalog.isMeasurement(fields.get(0))
        ? "array_join(measurements_key)"
        : "array_join(span_op_breakdowns_key)";
  }

  /** {@code measurements.lcp} is keyed {@code lcp}, {@code spans.db} is keyed {@code ops.db}. */
  static String arrayKey(String field) {
    if (ColumnCatalog.isMeasurement(field)) {
      return field.substring(field.indexOf('.') + 1);
    }
    return "ops." + field.substring(field.indexOf('.') + 1);
  }

  @Nullable
  private static String fieldOfKey(List<String> fields, @Nullable Object key) {
    return fields.stream()
        .filter(field -> arrayKey(field).equals(key))
        .findFirst()
        .orElse(null);
  }

  private static String minField(String field) {
    return String.format("min(%s)", field);
  }

  private static String maxField(String field) {
    return String.format("max(%s)", field);
  }

  private static String quartileField(String field, String percentile) {
    return String.format("percentile(%s, %s)", field, percentile);
  }

  @Nullable
  private static Double number(Map<String, Object> row, String alias) {
    Object value = row.get(FunctionCallParser.getFunctionAlias(alias));
    return value instanceof Number ? ((Number) value).doubleValue() : null;
  }

  @Nullable
  private static Double lowest(@Nullable Double current, @Nullable Double candidate) {
    if (candidate == null) {
      return current;
    }
    return current == null ? candidate : Math.min(current, candidate);
  }

  @Nullable
  private static Double highest(@Nullable Double current, @Nullable Double candidate) {
    if (candidate == null) {
      return current;
    }
    return current == null ? candidate : Math.max(current, candidate);
  }
}
