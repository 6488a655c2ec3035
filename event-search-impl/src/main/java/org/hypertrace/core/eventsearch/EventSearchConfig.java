package org.hypertrace.core.eventsearch;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.List;
import lombok.Value;
import lombok.experimental.NonFinal;

@Value
@NonFinal
public class EventSearchConfig {
  private static final String DEFAULT_CONFIG_RESOURCE = "application.conf";
  private static final String CONFIG_PATH_LIMITS = "limits";
  private static final String CONFIG_PATH_THRESHOLDS = "thresholds";
  private static final String CONFIG_PATH_ARRAY_COLUMNS = "columns.array";
  private static final String CONFIG_PATH_OTHER_KEY = "topEvents.otherKey";
  private static final String CONFIG_PATH_LIMIT_VALIDATION = "validation.limit";

  SearchLimitsConfig limits;
  ThresholdDefaultsConfig thresholdDefaults;
  List<String> arrayColumns;
  String otherKey;
  LimitValidationConfig limitValidationConfig;

  public EventSearchConfig(Config config) {
    Config resolved =
        config.withFallback(ConfigFactory.parseResources(DEFAULT_CONFIG_RESOURCE)).resolve();
    this.limits = new SearchLimitsConfig(resolved.getConfig(CONFIG_PATH_LIMITS));
    this.thresholdDefaults =
        new ThresholdDefaultsConfig(resolved.getConfig(CONFIG_PATH_THRESHOLDS));
    this.arrayColumns = List.copyOf(resolved.getStringList(CONFIG_PATH_ARRAY_COLUMNS));
    this.otherKey = resolved.getString(CONFIG_PATH_OTHER_KEY);
    this.limitValidationConfig =
        new LimitValidationConfig(resolved.getConfig(CONFIG_PATH_LIMIT_VALIDATION));
  }

  /** Configuration shipped with the compiler, without overrides. */
  public static EventSearchConfig defaults() {
    return new EventSearchConfig(ConfigFactory.empty());
  }

  @Value
  @NonFinal
  public static class SearchLimitsConfig {
    private static final String CONFIG_PATH_MAX_SEARCH_RELEASES = "maxSearchReleases";
    private static final String CONFIG_PATH_MAX_QUERYABLE_THRESHOLDS = "maxQueryableThresholds";
    private static final String CONFIG_PATH_MAX_HISTOGRAM_BUCKETS = "maxHistogramBuckets";

    int maxSearchReleases;
    int maxQueryableThresholds;
    int maxHistogramBuckets;

    private SearchLimitsConfig(Config config) {
      this.maxSearchReleases = config.getInt(CONFIG_PATH_MAX_SEARCH_RELEASES);
      this.maxQueryableThresholds = config.getInt(CONFIG_PATH_MAX_QUERYABLE_THRESHOLDS);
      this.maxHistogramBuckets = config.getInt(CONFIG_PATH_MAX_HISTOGRAM_BUCKETS);
    }
  }

  @Value
  @NonFinal
  public static class ThresholdDefaultsConfig {
    private static final String CONFIG_PATH_METRIC = "defaultMetric";
    private static final String CONFIG_PATH_THRESHOLD = "defaultThreshold";

    String metric;
    long threshold;

    private ThresholdDefaultsConfig(Config config) {
      this.metric = config.getString(CONFIG_PATH_METRIC);
      this.threshold = config.getLong(CONFIG_PATH_THRESHOLD);
    }
  }

  @Value
  @NonFinal
  public static class LimitValidationConfig {
    private static final String CONFIG_PATH_MIN = "min";
    private static final String CONFIG_PATH_MAX = "max";
    private static final String CONFIG_PATH_MODE = "mode";
    int min;
    int max;
    LimitValidationMode mode;

    private LimitValidationConfig(Config config) {
      this.min = config.getInt(CONFIG_PATH_MIN);
      this.max = config.getInt(CONFIG_PATH_MAX);
      this.mode = config.getEnum(LimitValidationMode.class, CONFIG_PATH_MODE);
    }

    public enum LimitValidationMode {
      DISABLED,
      WARN,
      ERROR
    }
  }
}
