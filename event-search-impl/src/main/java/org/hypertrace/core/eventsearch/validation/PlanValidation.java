package org.hypertrace.core.eventsearch.validation;

import io.reactivex.rxjava3.core.Completable;
import org.hypertrace.core.eventsearch.api.QueryPlan;
import org.hypertrace.core.eventsearch.plan.SearchRequest;

public interface PlanValidation {
  Completable validate(QueryPlan plan, SearchRequest request);
}
