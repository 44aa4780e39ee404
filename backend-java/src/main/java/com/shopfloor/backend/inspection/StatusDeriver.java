package com.shopfloor.backend.inspection;

import java.util.List;

/**
 * Aggregate status over the full item pool of an inspection. Always a complete recompute; nothing
 * is carried over between calls.
 *
 * <ol>
 *   <li>any failed critical item: {@link InspectionStatus#FAILED}</li>
 *   <li>pass rate below 70 %: {@link InspectionStatus#FAILED}</li>
 *   <li>pass rate below 100 %: {@link InspectionStatus#PARTIAL}</li>
 *   <li>otherwise {@link InspectionStatus#PASSED}; an empty pool counts as a 100 % pass rate</li>
 * </ol>
 */
public final class StatusDeriver {
  /** Pass rate (as a fraction of 10) under which an inspection fails. 7/10 itself is partial. */
  static final int FAIL_BELOW_TENTHS = 7;

  private StatusDeriver() {}

  public static InspectionStatus derive(List<InspectionResultItem> items) {
    long total = 0;
    long passed = 0;
    for (InspectionResultItem item : items) {
      total++;
      if (item.isPassed()) {
        passed++;
      } else if (item.isCriticalItem()) {
        return InspectionStatus.FAILED;
      }
    }
    if (total == 0) {
      return InspectionStatus.PASSED;
    }
    // integer form of passed/total < 0.70, exact at the boundary
    if (passed * 10 < total * FAIL_BELOW_TENTHS) {
      return InspectionStatus.FAILED;
    }
    return passed < total ? InspectionStatus.PARTIAL : InspectionStatus.PASSED;
  }

  public static double passRate(List<InspectionResultItem> items) {
    if (items.isEmpty()) {
      return 1d;
    }
    long passed = items.stream().filter(InspectionResultItem::isPassed).count();
    return (double) passed / items.size();
  }

  /** Re-derives and stores the status of {@code inspection}. */
  public static InspectionStatus refresh(InspectionResult inspection) {
    InspectionStatus status = derive(inspection.allItems());
    inspection.setStatus(status);
    return status;
  }
}
