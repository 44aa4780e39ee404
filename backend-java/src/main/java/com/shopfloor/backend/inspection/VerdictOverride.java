package com.shopfloor.backend.inspection;

/**
 * Manual verdict path. Writes {@code passed} directly, bypassing the typed comparison. For boolean
 * items the recorded value follows the verdict; numeric and text values are left as recorded, even
 * when they now disagree with the verdict.
 */
public final class VerdictOverride {
  private VerdictOverride() {}

  /**
   * @param definition template item behind {@code item}, or null when it can no longer be found
   */
  public static void apply(ChecklistTemplateItem definition, InspectionResultItem item, Verdict verdict) {
    boolean passed = verdict.passes();
    item.setPassed(passed);
    item.setVerdictSource(VerdictSource.MANUAL);
    item.setManualVerdict(verdict);
    if (definition != null && definition.type() == ItemType.BOOLEAN) {
      item.setResult(passed);
    }
  }
}
