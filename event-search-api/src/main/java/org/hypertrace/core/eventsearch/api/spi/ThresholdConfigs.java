package org.hypertrace.core.eventsearch.api.spi;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

/** Project level and transaction level threshold overrides, each ordered by project id. */
@Value
public class ThresholdConfigs {
  @NonNull List<ProjectThreshold> projectThresholds;
  @NonNull List<TransactionThreshold> transactionThresholds;

  public int size() {
    return projectThresholds.size() + transactionThresholds.size();
  }
}
