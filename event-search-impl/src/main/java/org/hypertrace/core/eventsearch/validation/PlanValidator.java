package org.hypertrace.core.eventsearch.validation;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Observable;
import java.util.Set;
import javax.inject.Inject;
import org.hypertrace.core.eventsearch.api.QueryPlan;
import org.hypertrace.core.eventsearch.plan.SearchRequest;

/**
 * Runs every registered validation against a compiled plan, passing only if all complete
 * successfully. Validations may run in any order. Each failing validation produces its own
 * error; several failures reach the caller as a {@code CompositeException}.
 */
public class PlanValidator {
  private final Set<PlanValidation> validations;

  @Inject
  PlanValidator(Set<PlanValidation> validations) {
    this.validations = validations;
  }

  public Completable validate(QueryPlan plan, SearchRequest request) {
    return Observable.fromIterable(validations)
        .flatMapCompletable(validation -> validation.validate(plan, request), true);
  }
}
