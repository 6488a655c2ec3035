package org.hypertrace.core.eventsearch.api.spi;

import io.reactivex.rxjava3.core.Single;
import org.hypertrace.core.eventsearch.api.QueryPlan;

/** Sends a plan to the analytic store. */
public interface QueryExecutor {

  Single<QueryResult> execute(QueryPlan plan);
}
