package org.hypertrace.core.eventsearch.validation;

import io.reactivex.rxjava3.observers.TestObserver;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.QueryPlan;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.plan.SearchRequest;
import org.junit.jupiter.api.Test;

class ProjectScopeValidationTest {
  QueryPlan mockPlan = QueryPlan.builder().build();
  ProjectScopeValidation projectScopeValidation = new ProjectScopeValidation();

  @Test
  void errorsOnMissingProjects() {
    TestObserver<Void> observer = new TestObserver<>();
    projectScopeValidation
        .validate(mockPlan, SearchRequest.builder().params(RequestParams.builder().build()).build())
        .blockingSubscribe(observer);
    observer.assertError(InvalidSearchQueryException.class);
  }

  @Test
  void passesWithProjects() {
    TestObserver<Void> observer = new TestObserver<>();
    projectScopeValidation
        .validate(
            mockPlan,
            SearchRequest.builder().params(RequestParams.builder().projectId(3L).build()).build())
        .blockingSubscribe(observer);
    observer.assertComplete();
  }
}
