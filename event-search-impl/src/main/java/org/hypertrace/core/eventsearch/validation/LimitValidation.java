package org.hypertrace.core.eventsearch.validation;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.INVALID_VALUE;

import io.reactivex.rxjava3.core.Completable;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.eventsearch.EventSearchConfig;
import org.hypertrace.core.eventsearch.EventSearchConfig.LimitValidationConfig;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.QueryPlan;
import org.hypertrace.core.eventsearch.plan.SearchRequest;

/** Plans without a limit are left to the execution layer's default. */
@Slf4j
class LimitValidation implements PlanValidation {

  LimitValidationConfig config;

  @Inject
  LimitValidation(EventSearchConfig eventSearchConfig) {
    this.config = eventSearchConfig.getLimitValidationConfig();
  }

  @Override
  public Completable validate(QueryPlan plan, SearchRequest request) {
    Integer limit = plan.getLimit();
    if (limit == null) {
      return Completable.complete();
    }

    switch (config.getMode()) {
      case ERROR:
        if (isInvalidLimit(limit)) {
          return Completable.error(
              new InvalidSearchQueryException(INVALID_VALUE, generateErrorMessageForLimit(limit)));
        }
        return Completable.complete();

      case WARN:
        if (isInvalidLimit(limit)) {
          log.warn(
              generateErrorMessageForLimit(limit) + ". Allowing due to warn mode.{}{}",
              System.lineSeparator(),
              request);
        }
        return Completable.complete();
      case DISABLED:
      default:
        return Completable.complete();
    }
  }

  private String generateErrorMessageForLimit(int limit) {
    return String.format(
        "Received invalid query limit of %s, required to be in range of [%s, %s]",
        limit, config.getMin(), config.getMax());
  }

  private boolean isInvalidLimit(int limit) {
    return limit < config.getMin() || limit > config.getMax();
  }
}
