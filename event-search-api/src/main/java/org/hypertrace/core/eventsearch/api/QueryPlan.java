package org.hypertrace.core.eventsearch.api;

import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Fully resolved query handed to the execution layer. Assembled through its builder by the
 * compiler; immutable once built so independent executions can share it.
 */
@Value
@Builder(toBuilder = true)
public class QueryPlan {
  @Singular List<Expression> selectedColumns;
  @Singular List<Expression> aggregations;

  @Singular("groupByExpression")
  List<Expression> groupBy;

  @Singular List<Condition> whereConditions;
  @Singular List<Condition> havingConditions;

  @Singular("orderByEntry")
  List<OrderBy> orderBy;

  /** Output alias to semantic type, for the columns and functions the caller asked for. */
  @Singular Map<String, ResultType> resultTypes;

  @Nullable Integer limit;
  @Nullable Integer offset;
}
