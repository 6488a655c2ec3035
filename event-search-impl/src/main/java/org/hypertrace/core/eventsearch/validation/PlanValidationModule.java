package org.hypertrace.core.eventsearch.validation;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;

public class PlanValidationModule extends AbstractModule {
  @Override
  protected void configure() {
    Multibinder<PlanValidation> validationMultibinder =
        Multibinder.newSetBinder(binder(), PlanValidation.class);
    validationMultibinder.addBinding().to(ProjectScopeValidation.class);
    validationMultibinder.addBinding().to(LimitValidation.class);
  }
}
