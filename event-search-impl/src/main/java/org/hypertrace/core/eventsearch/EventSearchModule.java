package org.hypertrace.core.eventsearch;

import com.google.inject.AbstractModule;
import com.typesafe.config.Config;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.hypertrace.core.eventsearch.api.spi.QueryExecutor;
import org.hypertrace.core.eventsearch.api.spi.SearchTokenizer;
import org.hypertrace.core.eventsearch.validation.PlanValidationModule;

/**
 * Binds the compiler. The embedder provides the {@link SearchTokenizer}, {@link CatalogService} and
 * {@link QueryExecutor} in its own module.
 */
public class EventSearchModule extends AbstractModule {

  private final EventSearchConfig config;

  public EventSearchModule(Config config) {
    this.config = new EventSearchConfig(config);
  }

  @Override
  protected void configure() {
    bind(EventSearchConfig.class).toInstance(this.config);
    requireBinding(SearchTokenizer.class);
    requireBinding(CatalogService.class);
    requireBinding(QueryExecutor.class);
    install(new PlanValidationModule());
  }
}
