package org.hypertrace.core.eventsearch.function;

import static org.hypertrace.core.eventsearch.function.FunctionArguments.aliasReference;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.column;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.condition;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.countColumn;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.date;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.durationColumn;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.fieldColumn;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.functionAlias;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.intervalDefault;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.nullColumn;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.nullableNumberRange;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.numberRange;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.numericColumn;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.numericColumnOrArray;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.quotedString;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.string;
import static org.hypertrace.core.eventsearch.function.FunctionArguments.stringArrayColumn;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.api.ResultType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Every function a field list or an aggregate filter may call. Built once, never mutated. */
@Singleton
public class FunctionRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(FunctionRegistry.class);

  /** Name used for aggregates precomputed by the caller. */
  public static final String PERCENTAGE = "percentage";

  private static final String THRESHOLD_DURATION =
      "multiIf(equals(tupleElement(project_threshold_config, 1), 'lcp'), measurements.lcp, "
          + "transaction.duration)";
  private static final String THRESHOLD_VALUE = "tupleElement(project_threshold_config, 2)";

  private static final Map<String, String> FUNCTION_ALIASES =
      ImmutableMap.of("tpm", "epm", "tps", "eps");

  private final Map<String, FunctionSpec> functions;

  public FunctionRegistry() {
    Map<String, FunctionSpec> declared =
        createFunctions().stream()
            .collect(ImmutableMap.toImmutableMap(FunctionSpec::getName, spec -> spec));
    ImmutableMap.Builder<String, FunctionSpec> builder = ImmutableMap.builder();
    builder.putAll(declared);
    FUNCTION_ALIASES.forEach(
        (alias, name) -> builder.put(alias, declared.get(name).aliasAs(alias)));
    this.functions = builder.build();
    LOG.info("Registered {} functions", functions.size());
  }

  public Optional<FunctionSpec> get(String name) {
    return Optional.ofNullable(functions.get(name));
  }

  public boolean contains(String name) {
    return functions.containsKey(name);
  }

  public Set<String> getNames() {
    return functions.keySet();
  }

  private static List<FunctionSpec> createFunctions() {
    return List.of(
        FunctionSpec.builder("percentile")
            .required(numericColumn("column"), numberRange("percentile", 0d, 1d))
            .emits(Emission.aggregate("quantile({percentile:g})({column})"))
            .resultTypeRule(ResultTypeRule.reflective(0))
            .defaultResultType(ResultType.DURATION)
            .redundantGrouping()
            .build(),
        quantile("p50", "quantile(0.5)"),
        quantile("p75", "quantile(0.75)"),
        quantile("p95", "quantile(0.95)"),
        quantile("p99", "quantile(0.99)"),
        quantile("p100", "max"),
        FunctionSpec.builder("eps")
            .optional(intervalDefault("interval", 1d, null))
            .emits(Emission.transform("divide(count(), {interval})"))
            .defaultResultType(ResultType.NUMBER)
            .build(),
        FunctionSpec.builder("epm")
            .optional(intervalDefault("interval", 1d, null))
            .emits(Emission.transform("divide(count(), divide({interval}, 60))"))
            .defaultResultType(ResultType.NUMBER)
            .build(),
        FunctionSpec.builder("last_seen")
            .emits(Emission.aggregate("max(timestamp)", "last_seen"))
            .defaultResultType(ResultType.DATE)
            .redundantGrouping()
            .build(),
        FunctionSpec.builder("latest_event")
            .emits(Emission.aggregate("argMax(id, timestamp)", "latest_event"))
            .defaultResultType(ResultType.STRING)
            .build(),
        FunctionSpec.builder("apdex")
            .optional(nullableNumberRange("satisfaction", 0d, null))
            .emits(
                Emission.conditionalTransform(
                    "satisfaction",
                    "apdex(transaction.duration, {satisfaction})",
                    "apdex(" + THRESHOLD_DURATION + ", " + THRESHOLD_VALUE + ")"))
            .defaultResultType(ResultType.NUMBER)
            .build(),
        FunctionSpec.builder("count_miserable")
            .required(countColumn("column"))
            .optional(nullableNumberRange("satisfaction", 0d, null))
            .calculated(CalculatedArgument.of("tolerated", FunctionRegistry::tolerated))
            .emits(
                Emission.conditionalTransform(
                    "satisfaction",
                    "uniqIf({column}, greater(transaction.duration, {tolerated}))",
                    "uniqIf({column}, greater(" + THRESHOLD_DURATION + ", multiply("
                        + THRESHOLD_VALUE + ", 4)))"))
            .defaultResultType(ResultType.INTEGER)
            .build(),
        // user misery is modeled as a beta distribution with a prior mean of 0.05 and
        // variance of 0.0004, which gives alpha 5.8875 and beta 111.8625
        FunctionSpec.builder("user_misery")
            .optional(
                nullableNumberRange("satisfaction", 0d, null),
                numberRange("alpha", 0d, null).withDefault("5.8875"),
                numberRange("beta", 0d, null).withDefault("111.8625"))
            .calculated(
                CalculatedArgument.of("tolerated", FunctionRegistry::tolerated),
                CalculatedArgument.of(
                    "parameter_sum",
                    values -> (Double) values.get("alpha") + (Double) values.get("beta")))
            .emits(
                Emission.conditionalTransform(
                    "satisfaction",
                    "ifNull(divide(plus(uniqIf(user, greater(transaction.duration, {tolerated})), "
                        + "{alpha}), plus(uniq(user), {parameter_sum})), 0)",
                    "ifNull(divide(plus(uniqIf(user, greater(" + THRESHOLD_DURATION
                        + ", multiply(" + THRESHOLD_VALUE + ", 4))), {alpha}), "
                        + "plus(uniq(user), {parameter_sum})), 0)"))
            .defaultResultType(ResultType.NUMBER)
            .build(),
        FunctionSpec.builder("failure_rate")
            .emits(Emission.transform("failure_rate()"))
            .defaultResultType(ResultType.PERCENTAGE)
            .build(),
        // ok, cancelled and unknown are not failures
        FunctionSpec.builder("failure_count")
            .emits(Emission.aggregate("countIf(not(has(array(0, 1, 2), transaction.status)))"))
            .defaultResultType(ResultType.INTEGER)
            .build(),
        FunctionSpec.builder("array_join")
            .required(stringArrayColumn("column"))
            .emits(Emission.column("arrayJoin({column})"))
            .defaultResultType(ResultType.STRING)
            .privateFunction()
            .build(),
        // bucket_size and start_offset are already scaled by the multiplier
        FunctionSpec.builder("histogram")
            .required(
                numericColumnOrArray("column"),
                numberRange("bucket_size", 1d, null),
                numberRange("start_offset", null, null),
                numberRange("multiplier", 1d, null))
            .emits(
                Emission.column(
                    "plus(multiply(floor(divide(minus(multiply({column}, {multiplier}), "
                        + "{start_offset}), {bucket_size})), {bucket_size}), {start_offset})"))
            .defaultResultType(ResultType.NUMBER)
            .privateFunction()
            .build(),
        FunctionSpec.builder("count_unique")
            .optional(countColumn("column"))
            .emits(Emission.aggregate("uniq({column})"))
            .defaultResultType(ResultType.INTEGER)
            .build(),
        FunctionSpec.builder("count")
            .optional(nullColumn("column"))
            .emits(Emission.aggregate("count()"))
            .defaultResultType(ResultType.INTEGER)
            .build(),
        FunctionSpec.builder("count_at_least")
            .required(numericColumn("column"), numberRange("threshold", 0d, null))
            .emits(Emission.aggregate("countIf(greaterOrEquals({column}, {threshold}))"))
            .defaultResultType(ResultType.INTEGER)
            .build(),
        simpleAggregate("min", "min", true),
        simpleAggregate("max", "max", true),
        simpleAggregate("avg", "avg", true),
        FunctionSpec.builder("var")
            .required(numericColumn("column"))
            .emits(Emission.aggregate("varSamp({column})"))
            .defaultResultType(ResultType.NUMBER)
            .redundantGrouping()
            .build(),
        FunctionSpec.builder("stddev")
            .required(numericColumn("column"))
            .emits(Emission.aggregate("stddevSamp({column})"))
            .defaultResultType(ResultType.NUMBER)
            .redundantGrouping()
            .build(),
        simpleAggregate("sum", "sum", false),
        FunctionSpec.builder("any")
            .required(fieldColumn("column"))
            .emits(Emission.aggregate("min({column})"))
            .resultTypeRule(ResultTypeRule.reflective(0))
            .redundantGrouping()
            .build(),
        FunctionSpec.builder("absolute_delta")
            .required(durationColumn("column"), numberRange("target", 0d, null))
            .emits(Emission.column("abs(minus({column}, {target}))"))
            .defaultResultType(ResultType.DURATION)
            .build(),
        // range functions compare the event timestamp with a breakpoint, used by trends
        FunctionSpec.builder("percentile_range")
            .required(
                numericColumn("column"),
                numberRange("percentile", 0d, 1d),
                condition("condition"),
                date("middle"))
            .emits(
                Emission.aggregate(
                    "quantileIf({percentile:.2f})({column}, "
                        + "{condition}(toDateTime({middle}), timestamp))"))
            .defaultResultType(ResultType.DURATION)
            .build(),
        rangeAggregate("avg_range", "avgIf"),
        rangeAggregate("variance_range", "varSampIf"),
        FunctionSpec.builder("count_range")
            .required(condition("condition"), date("middle"))
            .emits(Emission.aggregate("countIf({condition}(toDateTime({middle}), timestamp))"))
            .defaultResultType(ResultType.INTEGER)
            .build(),
        // an aggregate so that conditions on it end up in having
        FunctionSpec.builder(PERCENTAGE)
            .required(aliasReference("numerator"), aliasReference("denominator"))
            .emits(
                Emission.aggregate(
                    "if(greater({denominator}, 0), divide({numerator}, {denominator}), null)"))
            .defaultResultType(ResultType.PERCENTAGE)
            .build(),
        // Welch's t-test over two periods
        FunctionSpec.builder("t_test")
            .required(
                functionAlias("avg_1"),
                functionAlias("avg_2"),
                functionAlias("variance_1"),
                functionAlias("variance_2"),
                functionAlias("count_1"),
                functionAlias("count_2"))
            .emits(
                Emission.aggregate(
                    "divide(minus({avg_1}, {avg_2}), sqrt(plus(divide({variance_1}, {count_1}), "
                        + "divide({variance_2}, {count_2}))))",
                    "t_test"))
            .defaultResultType(ResultType.NUMBER)
            .build(),
        FunctionSpec.builder("minus")
            .required(aliasReference("minuend"), aliasReference("subtrahend"))
            .emits(Emission.aggregate("minus({minuend}, {subtrahend})"))
            .defaultResultType(ResultType.DURATION)
            .build(),
        FunctionSpec.builder("absolute_correlation")
            .emits(
                Emission.aggregate(
                    "abs(corr(toUnixTimestamp(timestamp), transaction.duration))"))
            .defaultResultType(ResultType.NUMBER)
            .build(),
        FunctionSpec.builder("count_if")
            .required(
                column("column", "event.type", "http.status_code"),
                condition("condition"),
                string("value"))
            .emits(Emission.aggregate("countIf({condition}({column}, {value}))"))
            .defaultResultType(ResultType.INTEGER)
            .build(),
        FunctionSpec.builder("compare_numeric_aggregate")
            .required(
                functionAlias("aggregate_alias"),
                condition("condition"),
                numberRange("value", 0d, null))
            .emits(Emission.aggregate("{condition}({aggregate_alias}, {value})"))
            .defaultResultType(ResultType.NUMBER)
            .build(),
        FunctionSpec.builder("to_other")
            .required(column("column", "release", "trace.parent_span"), quotedString("value"))
            .optional(string("that").withDefault("that"), string("this").withDefault("this"))
            .emits(Emission.column("if(equals({column}, {value}), {this}, {that})"))
            .build());
  }

  private static FunctionSpec quantile(String name, String aggregate) {
    return FunctionSpec.builder(name)
        .optional(numericColumn("column").withDefault("transaction.duration"))
        .emits(Emission.aggregate(aggregate + "({column})"))
        .resultTypeRule(ResultTypeRule.reflective(0))
        .defaultResultType(ResultType.DURATION)
        .redundantGrouping()
        .build();
  }

  private static FunctionSpec simpleAggregate(
      String name, String aggregate, boolean redundantGrouping) {
    FunctionSpec.Builder builder =
        FunctionSpec.builder(name)
            .required(numericColumn("column"))
            .emits(Emission.aggregate(aggregate + "({column})"))
            .resultTypeRule(ResultTypeRule.reflective(0))
            .defaultResultType(ResultType.DURATION);
    if (redundantGrouping) {
      builder.redundantGrouping();
    }
    return builder.build();
  }

  private static FunctionSpec rangeAggregate(String name, String aggregate) {
    return FunctionSpec.builder(name)
        .required(numericColumn("column"), condition("condition"), date("middle"))
        .emits(
            Emission.aggregate(
                aggregate + "({column}, {condition}(toDateTime({middle}), timestamp))"))
        .defaultResultType(ResultType.DURATION)
        .build();
  }

  private static Object tolerated(Map<String, Object> values) {
    Object satisfaction = values.get("satisfaction");
    return satisfaction == null ? null : ((Double) satisfaction) * 4.0;
  }
}
