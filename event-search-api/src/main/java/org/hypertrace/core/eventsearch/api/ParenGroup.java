package org.hypertrace.core.eventsearch.api;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class ParenGroup implements ParsedTerm {
  @NonNull @Singular List<ParsedTerm> children;

  public static ParenGroup of(ParsedTerm... children) {
    return new ParenGroup(List.of(children));
  }

  @Override
  public TermCase getTermCase() {
    return TermCase.PAREN_GROUP;
  }
}
