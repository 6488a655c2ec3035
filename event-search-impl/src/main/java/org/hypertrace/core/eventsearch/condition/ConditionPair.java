package org.hypertrace.core.eventsearch.condition;

import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Value;
import org.hypertrace.core.eventsearch.api.Condition;

/** Compiled form of a group of terms: the row level part and the aggregate level part. */
@Value
public class ConditionPair {
  private static final ConditionPair EMPTY = new ConditionPair(null, null);

  @Nullable Condition where;
  @Nullable Condition having;

  public static ConditionPair empty() {
    return EMPTY;
  }

  public static ConditionPair where(Condition condition) {
    return new ConditionPair(condition, null);
  }

  public static ConditionPair having(Condition condition) {
    return new ConditionPair(null, condition);
  }

  public Optional<Condition> getWhereCondition() {
    return Optional.ofNullable(where);
  }

  public Optional<Condition> getHavingCondition() {
    return Optional.ofNullable(having);
  }

  public boolean hasWhere() {
    return where != null;
  }

  public boolean hasHaving() {
    return having != null;
  }

  public List<Condition> flattenWhere() {
    return where == null ? List.of() : ConditionFlattener.flatten(where);
  }

  public List<Condition> flattenHaving() {
    return having == null ? List.of() : ConditionFlattener.flatten(having);
  }
}
