package org.hypertrace.core.eventsearch.validation;

import static org.hypertrace.core.eventsearch.api.InvalidSearchQueryException.Reason.MISSING_PARAMETER;

import io.reactivex.rxjava3.core.Completable;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.QueryPlan;
import org.hypertrace.core.eventsearch.plan.SearchRequest;

class ProjectScopeValidation implements PlanValidation {
  @Override
  public Completable validate(QueryPlan plan, SearchRequest request) {
    if (request.getParams().getProjectIds().isEmpty()) {
      return Completable.error(
          new InvalidSearchQueryException(
              MISSING_PARAMETER, "No projects selected for the query"));
    }
    return Completable.complete();
  }
}
