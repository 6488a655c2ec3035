package org.hypertrace.core.eventsearch.plan;

import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.hypertrace.core.eventsearch.api.RequestParams;

/** Everything a caller asks the compiler for. */
@Value
@Builder(toBuilder = true)
public class SearchRequest {
  /** Search text, tokenized by the {@code SearchTokenizer}. */
  @Nullable String query;

  /** Plain fields and function text, in output order. */
  @Singular List<String> selectedFields;

  /** Field or alias names, prefixed with {@code -} for descending order. */
  @Singular("orderByField")
  List<String> orderBy;

  RequestParams params;

  /** Private functions the caller may use. */
  @Singular("functionAcl")
  Set<String> functionsAcl;

  @Builder.Default boolean useAggregateConditions = true;
  boolean autoFields;
  boolean autoAggregations;

  @Nullable Integer limit;
  @Nullable Integer offset;
}
