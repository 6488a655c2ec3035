package org.hypertrace.core.eventsearch.function;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.INVALID_ARGUMENT;
import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.TOO_FEW_ARGUMENTS;
import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.TOO_MANY_ARGUMENTS;
import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.UNKNOWN_FUNCTION;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.eventsearch.api.AccessDeniedException;
import org.hypertrace.core.eventsearch.api.ColumnReference;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.FunctionCall;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.ResultType;
import org.hypertrace.core.eventsearch.function.FunctionCallParser.ParsedFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves function text against the {@link FunctionRegistry}: access check, argument count,
 * defaults, normalization, calculated arguments, rendering, alias and result type.
 */
@Singleton
public class FunctionResolver {
  private static final Logger LOG = LoggerFactory.getLogger(FunctionResolver.class);

  private final FunctionRegistry registry;

  @Inject
  public FunctionResolver(FunctionRegistry registry) {
    this.registry = registry;
  }

  public boolean isFunction(String field) {
    return FunctionCallParser.parse(field)
        .map(parsed -> registry.contains(parsed.getName()))
        .orElse(false);
  }

  /**
   * @throws InvalidSearchQueryException when the function is unknown or its arguments invalid
   * @throws AccessDeniedException when the function is private and not in {@code functionsAcl}
   */
  public ResolvedFunction resolve(
      String field, ArgumentContext context, Collection<String> functionsAcl) {
    Expression precomputed = context.getParams().getAliases().get(field);
    if (precomputed != null) {
      return resolvePrecomputed(field, precomputed);
    }

    ParsedFunction parsed =
        FunctionCallParser.parse(field)
            .filter(function -> registry.contains(function.getName()))
            .orElseThrow(
                () ->
                    new InvalidSearchQueryException(
                        UNKNOWN_FUNCTION, String.format("%s is not a valid function", field)));
    FunctionSpec spec = registry.get(parsed.getName()).orElseThrow();
    if (!spec.isAccessible(functionsAcl)) {
      throw new AccessDeniedException(
          String.format("%s: no access to private function", spec.getName()));
    }

    List<String> rawArguments = addDefaultArguments(spec, parsed, context);
    Map<String, FunctionArgument> argumentsByName = new LinkedHashMap<>();
    Map<String, Object> values = new LinkedHashMap<>();
    List<FunctionArgument> arguments = spec.getArguments();
    for (int i = 0; i < arguments.size(); i++) {
      FunctionArgument argument = arguments.get(i);
      argumentsByName.put(argument.getName(), argument);
      try {
        values.put(argument.getName(), argument.normalize(rawArguments.get(i), context));
      } catch (IllegalArgumentException e) {
        throw new InvalidSearchQueryException(
            INVALID_ARGUMENT,
            String.format("%s: %s argument invalid: %s", field, argument.getName(), e.getMessage()),
            e);
      }
    }
    for (CalculatedArgument calculated : spec.getCalculatedArguments()) {
      values.put(
          calculated.getName(),
          calculated.getDerivation().apply(Collections.unmodifiableMap(values)));
    }

    Expression rendered =
        spec.getEmission().render(new TemplateBindings(argumentsByName, values, context));
    String alias = parsed.getAlias();
    if (alias == null) {
      alias =
          spec.getEmission().getFixedAlias() != null
              ? spec.getEmission().getFixedAlias()
              : FunctionCallParser.deriveAlias(spec.getName(), parsed.getArguments());
    }
    ResultType resultType = spec.getResultType(values);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Resolved {} to {} as {}", field, rendered, alias);
    }
    return new ResolvedFunction(
        field,
        spec,
        withAlias(rendered, alias),
        alias,
        resultType,
        Collections.unmodifiableMap(values));
  }

  private ResolvedFunction resolvePrecomputed(String field, Expression precomputed) {
    String alias =
        precomputed.getAlias() != null
            ? precomputed.getAlias()
            : FunctionCallParser.getFunctionAlias(field);
    FunctionSpec spec = registry.get(FunctionRegistry.PERCENTAGE).orElseThrow();
    return new ResolvedFunction(
        field,
        spec,
        withAlias(precomputed, alias),
        alias,
        spec.getDefaultResultType(),
        Collections.emptyMap());
  }

  /** Checks the argument count, then pads trailing optional arguments with their defaults. */
  private static List<String> addDefaultArguments(
      FunctionSpec spec, ParsedFunction parsed, ArgumentContext context) {
    String field = parsed.getField();
    int count = parsed.getArguments().size();
    int required = spec.getRequiredArgumentCount();
    int total = spec.getTotalArgumentCount();
    if (count != total) {
      if (required == total) {
        throw new InvalidSearchQueryException(
            count < total ? TOO_FEW_ARGUMENTS : TOO_MANY_ARGUMENTS,
            String.format("%s: expected %d argument(s)", field, total));
      } else if (count < required) {
        throw new InvalidSearchQueryException(
            TOO_FEW_ARGUMENTS,
            String.format("%s: expected at least %d argument(s)", field, required));
      } else if (count > total) {
        throw new InvalidSearchQueryException(
            TOO_MANY_ARGUMENTS,
            String.format("%s: expected at most %d argument(s)", field, total));
      }
    }

    List<String> arguments = new ArrayList<>(parsed.getArguments());
    List<FunctionArgument> declared = spec.getArguments();
    for (FunctionArgument argument : declared.subList(count, declared.size())) {
      try {
        arguments.add(argument.getDefault(context));
      } catch (IllegalArgumentException e) {
        throw new InvalidSearchQueryException(
            INVALID_ARGUMENT, String.format("%s: invalid arguments: %s", field, e.getMessage()), e);
      }
    }
    return arguments;
  }

  public static Expression withAlias(Expression expression, String alias) {
    if (expression instanceof FunctionCall) {
      return ((FunctionCall) expression).withAlias(alias);
    }
    if (expression instanceof ColumnReference) {
      return ((ColumnReference) expression).withAlias(alias);
    }
    return FunctionCall.of("identity", expression).withAlias(alias);
  }
}
