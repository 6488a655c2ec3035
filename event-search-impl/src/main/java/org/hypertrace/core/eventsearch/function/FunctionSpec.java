package org.hypertrace.core.eventsearch.function;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import org.hypertrace.core.eventsearch.api.ResultType;

/**
 * Declaration of one function: its arguments, what it emits and how its result is typed.
 * Instances are only created through {@link #builder(String)} and are checked when built.
 */
public class FunctionSpec {
  private final String name;
  private final List<FunctionArgument> requiredArguments;
  private final List<FunctionArgument> optionalArguments;
  private final List<CalculatedArgument> calculatedArguments;
  private final Emission emission;
  @Nullable private final ResultTypeRule resultTypeRule;
  @Nullable private final ResultType defaultResultType;
  private final boolean redundantGrouping;
  private final boolean privateFunction;

  private FunctionSpec(Builder builder, String name) {
    this.name = name;
    this.requiredArguments = ImmutableList.copyOf(builder.requiredArguments);
    this.optionalArguments = ImmutableList.copyOf(builder.optionalArguments);
    this.calculatedArguments = ImmutableList.copyOf(builder.calculatedArguments);
    this.emission = builder.emission;
    this.resultTypeRule = builder.resultTypeRule;
    this.defaultResultType = builder.defaultResultType;
    this.redundantGrouping = builder.redundantGrouping;
    this.privateFunction = builder.privateFunction;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  public List<FunctionArgument> getRequiredArguments() {
    return requiredArguments;
  }

  public List<FunctionArgument> getOptionalArguments() {
    return optionalArguments;
  }

  /** Required arguments followed by optional ones, in declaration order. */
  public List<FunctionArgument> getArguments() {
    return ImmutableList.<FunctionArgument>builder()
        .addAll(requiredArguments)
        .addAll(optionalArguments)
        .build();
  }

  public List<CalculatedArgument> getCalculatedArguments() {
    return calculatedArguments;
  }

  public int getRequiredArgumentCount() {
    return requiredArguments.size();
  }

  public int getTotalArgumentCount() {
    return requiredArguments.size() + optionalArguments.size();
  }

  public Emission getEmission() {
    return emission;
  }

  public boolean isAggregate() {
    return emission.isAggregate();
  }

  public boolean isRedundantGrouping() {
    return redundantGrouping;
  }

  public boolean isPrivate() {
    return privateFunction;
  }

  public boolean isAccessible(Collection<String> functionsAcl) {
    return !privateFunction || functionsAcl.contains(name);
  }

  @Nullable
  public ResultType getDefaultResultType() {
    return defaultResultType;
  }

  @Nullable
  public ResultType getResultType(Map<String, Object> values) {
    if (resultTypeRule == null) {
      return defaultResultType;
    }
    ResultType resultType = resultTypeRule.apply(getArguments(), values);
    return resultType == null ? defaultResultType : resultType;
  }

  /** The same function registered under another name, {@code tpm} for {@code epm}. */
  public FunctionSpec aliasAs(String alias) {
    Builder builder = new Builder(alias);
    builder.requiredArguments.addAll(requiredArguments);
    builder.optionalArguments.addAll(optionalArguments);
    builder.calculatedArguments.addAll(calculatedArguments);
    builder.emission = emission;
    builder.resultTypeRule = resultTypeRule;
    builder.defaultResultType = defaultResultType;
    builder.redundantGrouping = redundantGrouping;
    builder.privateFunction = privateFunction;
    return builder.build();
  }

  @Override
  public String toString() {
    return name + getArguments();
  }

  public static class Builder {
    private final String name;
    private final List<FunctionArgument> requiredArguments = new ArrayList<>();
    private final List<FunctionArgument> optionalArguments = new ArrayList<>();
    private final List<CalculatedArgument> calculatedArguments = new ArrayList<>();
    private Emission emission;
    private ResultTypeRule resultTypeRule;
    private ResultType defaultResultType;
    private boolean redundantGrouping;
    private boolean privateFunction;

    private Builder(String name) {
      this.name = name;
    }

    public Builder required(FunctionArgument... arguments) {
      requiredArguments.addAll(List.of(arguments));
      return this;
    }

    public Builder optional(FunctionArgument... arguments) {
      optionalArguments.addAll(List.of(arguments));
      return this;
    }

    public Builder calculated(CalculatedArgument... arguments) {
      calculatedArguments.addAll(List.of(arguments));
      return this;
    }

    public Builder emits(Emission emission) {
      this.emission = emission;
      return this;
    }

    public Builder resultTypeRule(ResultTypeRule resultTypeRule) {
      this.resultTypeRule = resultTypeRule;
      return this;
    }

    public Builder defaultResultType(ResultType defaultResultType) {
      this.defaultResultType = defaultResultType;
      return this;
    }

    public Builder redundantGrouping() {
      this.redundantGrouping = true;
      return this;
    }

    public Builder privateFunction() {
      this.privateFunction = true;
      return this;
    }

    /**
     * @throws IllegalStateException when an optional argument has no default, an argument name is
     *     declared twice, no emission is set or a template refers to an undeclared argument
     */
    public FunctionSpec build() {
      if (emission == null) {
        throw new IllegalStateException(String.format("%s: an emission is required", name));
      }
      for (int i = 0; i < optionalArguments.size(); i++) {
        if (!optionalArguments.get(i).hasDefault()) {
          throw new IllegalStateException(
              String.format("%s: optional argument at index %d does not have default", name, i));
        }
      }
      Set<String> names = new HashSet<>();
      List<String> declared = new ArrayList<>();
      requiredArguments.forEach(argument -> declared.add(argument.getName()));
      optionalArguments.forEach(argument -> declared.add(argument.getName()));
      calculatedArguments.forEach(argument -> declared.add(argument.getName()));
      for (String argumentName : declared) {
        if (!names.add(argumentName)) {
          throw new IllegalStateException(
              String.format("%s: argument %s specified more than once", name, argumentName));
        }
      }
      for (String placeholder : emission.getPlaceholders()) {
        if (!names.contains(placeholder)) {
          throw new IllegalStateException(
              String.format("%s: template refers to undeclared argument %s", name, placeholder));
        }
      }
      return new FunctionSpec(this, name);
    }
  }
}
