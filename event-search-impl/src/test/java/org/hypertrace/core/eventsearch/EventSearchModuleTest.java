package org.hypertrace.core.eventsearch;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;

import com.google.inject.AbstractModule;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.typesafe.config.ConfigFactory;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.hypertrace.core.eventsearch.api.spi.QueryExecutor;
import org.hypertrace.core.eventsearch.api.spi.SearchTokenizer;
import org.hypertrace.core.eventsearch.histogram.HistogramEngine;
import org.hypertrace.core.eventsearch.plan.EventSearchCompiler;
import org.hypertrace.core.eventsearch.topevents.TopEventsTimeseriesMerger;
import org.junit.jupiter.api.Test;

class EventSearchModuleTest {
  @Test
  public void testResolveBindings() {
    assertDoesNotThrow(
        () ->
            Guice.createInjector(
                    new EventSearchModule(ConfigFactory.empty()), new MockProvidersModule())
                .getAllBindings());
  }

  @Test
  public void testCreatesEntryPoints() {
    Injector injector =
        Guice.createInjector(
            new EventSearchModule(ConfigFactory.empty()), new MockProvidersModule());
    assertNotNull(injector.getInstance(EventSearchCompiler.class));
    assertNotNull(injector.getInstance(HistogramEngine.class));
    assertNotNull(injector.getInstance(TopEventsTimeseriesMerger.class));
  }

  @Test
  public void testRequiresProviders() {
    assertThrows(
        CreationException.class,
        () -> Guice.createInjector(new EventSearchModule(ConfigFactory.empty())));
  }

  private static class MockProvidersModule extends AbstractModule {
    @Override
    protected void configure() {
      bind(SearchTokenizer.class).toInstance(mock(SearchTokenizer.class));
      bind(CatalogService.class).toInstance(mock(CatalogService.class));
      bind(QueryExecutor.class).toInstance(mock(QueryExecutor.class));
    }
  }
}
