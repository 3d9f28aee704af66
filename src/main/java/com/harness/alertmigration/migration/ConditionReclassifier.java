package com.harness.alertmigration.migration;

import com.harness.alertmigration.model.ConditionDto;
import org.springframework.stereotype.Component;

@Component
public class ConditionReclassifier {

  /**
   * Returns the filter version of the given condition, or the condition itself when it has
   * no filter equivalent. Parameters are carried over untouched.
   */
  public ConditionDto reclassify(ConditionDto condition) {
    return ConditionFilterMapping.filterFor(condition.id())
        .map(condition::withId)
        .orElse(condition);
  }
}
