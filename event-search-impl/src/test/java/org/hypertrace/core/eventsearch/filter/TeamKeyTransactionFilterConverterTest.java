package org.hypertrace.core.eventsearch.filter;

import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.column;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.condition;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.function;
import static org.hypertrace.core.eventsearch.api.util.QueryPlanUtil.literal;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.util.List;
import org.hypertrace.core.eventsearch.api.ConditionOperator;
import org.hypertrace.core.eventsearch.api.Expression;
import org.hypertrace.core.eventsearch.api.FilterOperator;
import org.hypertrace.core.eventsearch.api.InvalidSearchQueryException;
import org.hypertrace.core.eventsearch.api.RequestParams;
import org.hypertrace.core.eventsearch.api.SearchFilter;
import org.hypertrace.core.eventsearch.api.spi.CatalogService;
import org.hypertrace.core.eventsearch.api.spi.KeyTransaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class TeamKeyTransactionFilterConverterTest {
  private final TeamKeyTransactionFilterConverter converter =
      new TeamKeyTransactionFilterConverter();
  @Mock private CatalogService catalogService;
  private StubFilterContext context;

  @BeforeEach
  public void setup() {
    context =
        new StubFilterContext(
            RequestParams.builder().organizationId(5L).teamId(8L).projectId(1L).build(),
            catalogService);
  }

  @Test
  public void testKeyTransactions() {
    when(catalogService.resolveTeamKeyTransactions(eq(5L), any(), any()))
        .thenReturn(List.of(new KeyTransaction(1L, "checkout")));
    Expression isKeyTransaction =
        function(
            "in",
            function("tuple", column("project_id"), column("transaction_name")),
            function(
                "array",
                function("tuple", function("toUInt64", literal(1L)), literal("checkout"))));

    assertEquals(
        condition(isKeyTransaction, ConditionOperator.EQ, 1L),
        converter
            .convert(SearchFilter.of("team_key_transaction", FilterOperator.EQ, 1L), context)
            .get());
    assertEquals(
        condition(isKeyTransaction, ConditionOperator.EQ, 0L),
        converter
            .convert(SearchFilter.of("team_key_transaction", FilterOperator.NEQ, "1"), context)
            .get());
  }

  @Test
  public void testWithoutKeyTransactions() {
    when(catalogService.resolveTeamKeyTransactions(eq(5L), any(), any())).thenReturn(List.of());
    assertEquals(
        condition(function("toInt8", literal(0L)), ConditionOperator.NEQ, 0L),
        converter
            .convert(SearchFilter.of("team_key_transaction", FilterOperator.NEQ, ""), context)
            .get());
  }

  @Test
  public void testInvalidValue() {
    assertThrows(
        InvalidSearchQueryException.class,
        () ->
            converter.convert(
                SearchFilter.of("team_key_transaction", FilterOperator.EQ, "yes"), context));
  }

  @Test
  public void testRequiresTeams() {
    InvalidSearchQueryException exception =
        assertThrows(
            InvalidSearchQueryException.class,
            () ->
                converter.convert(
                    SearchFilter.of("team_key_transaction", FilterOperator.EQ, 1L),
                    new StubFilterContext(
                        RequestParams.builder().organizationId(5L).build(), catalogService)));
    assertEquals(InvalidSearchQueryException.Reason.MISSING_PARAMETER, exception.getReason());
  }
}
