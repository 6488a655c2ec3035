package org.hypertrace.core.eventsearch.condition;

import java.util.Collection;
import org.hypertrace.core.eventsearch.function.ArgumentContext;
import org.hypertrace.core.eventsearch.function.ResolvedFunction;

public interface AggregateFilterContext extends ArgumentContext {

  Collection<String> getFunctionsAcl();

  /** Records a function a having condition refers to, checked against the selection later. */
  void addHavingFunction(ResolvedFunction function);
}
