package com.shopfloor.backend.inspection;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Editing session over one {@link InspectionResult}. Every mutation runs to completion, including
 * the status recompute, before it returns.
 *
 * <p>The session keeps the template the inspection is bound to so that value edits can be judged
 * against the item definitions. It may be null when the template is gone; value edits then leave
 * the item failed and only manual verdicts can pass it.
 */
public class InspectionEditor {
  private final InspectionResult inspection;
  private ChecklistTemplate template;

  public InspectionEditor(InspectionResult inspection, ChecklistTemplate template) {
    this.inspection = inspection;
    this.template = template;
    StatusDeriver.refresh(inspection);
  }

  /** Starts a new, unsaved inspection bound to {@code template}. */
  public static InspectionEditor start(
      ChecklistTemplate template,
      String orderId,
      String itemId,
      String inspector,
      OffsetDateTime inspectionDate) {
    InspectionResult inspection = new InspectionResult();
    inspection.setOrderId(orderId);
    inspection.setItemId(itemId);
    inspection.setInspector(inspector);
    inspection.setInspectionDate(inspectionDate);
    TemplateBinder.bind(inspection, template);
    return new InspectionEditor(inspection, template);
  }

  public InspectionResult inspection() {
    return inspection;
  }

  public ChecklistTemplate template() {
    return template;
  }

  /**
   * Switches the inspection to another template. Ignored for persisted inspections.
   *
   * @return whether the sections were rebuilt
   */
  public boolean selectTemplate(ChecklistTemplate next) {
    if (!TemplateBinder.bind(inspection, next)) {
      return false;
    }
    this.template = next;
    return true;
  }

  /** Records a measured value and re-evaluates the item against its definition. */
  public Optional<InspectionResultItem> recordValue(String sectionId, String itemId, Object value) {
    Optional<InspectionResultItem> target = inspection.findItem(sectionId, itemId);
    target.ifPresent(item -> {
      ChecklistTemplateItem definition = definition(sectionId, itemId);
      item.setResult(value);
      item.setPassed(definition != null && ItemEvaluator.evaluate(definition, value));
      item.setVerdictSource(VerdictSource.AUTOMATIC);
      item.setManualVerdict(null);
    });
    StatusDeriver.refresh(inspection);
    return target;
  }

  /** Sets the item's verdict directly. */
  public Optional<InspectionResultItem> setVerdict(String sectionId, String itemId, Verdict verdict) {
    Optional<InspectionResultItem> target = inspection.findItem(sectionId, itemId);
    target.ifPresent(item -> VerdictOverride.apply(definition(sectionId, itemId), item, verdict));
    StatusDeriver.refresh(inspection);
    return target;
  }

  public Optional<InspectionResultItem> setItemComment(String sectionId, String itemId, String comments) {
    Optional<InspectionResultItem> target = inspection.findItem(sectionId, itemId);
    target.ifPresent(item -> item.setComments(comments));
    StatusDeriver.refresh(inspection);
    return target;
  }

  /**
   * Takes over what was recorded on {@code snapshot}, matched by section and item id, and judges it
   * again. The bound shape, descriptions and criticality are kept; snapshot items without a match
   * are ignored. Manual verdicts are re-applied. An automatic item passes only when the snapshot
   * marks it passed and its value passes the evaluator, so a value that was never recorded stays
   * failed. Without a template an automatic item keeps its previous verdict only while its value
   * is unchanged.
   */
  public void adoptRecorded(InspectionResult snapshot) {
    for (InspectionResultSection section : inspection.getSections()) {
      for (InspectionResultItem item : section.getItems()) {
        snapshot.findItem(section.getId(), item.getId())
            .ifPresent(recorded -> adopt(definition(section.getId(), item.getId()), item, recorded));
      }
    }
    StatusDeriver.refresh(inspection);
  }

  private static void adopt(ChecklistTemplateItem definition, InspectionResultItem item, InspectionResultItem recorded) {
    boolean keptVerdict = item.isPassed()
        && item.getVerdictSource() == VerdictSource.AUTOMATIC
        && Objects.equals(item.getResult(), recorded.getResult());

    item.setResult(recorded.getResult());
    item.setComments(recorded.getComments());
    item.setPhotos(recorded.getPhotos());

    if (recorded.getVerdictSource() == VerdictSource.MANUAL && recorded.getManualVerdict() != null) {
      VerdictOverride.apply(definition, item, recorded.getManualVerdict());
      return;
    }
    boolean passed = definition == null
        ? keptVerdict
        : recorded.isPassed() && ItemEvaluator.evaluate(definition, recorded.getResult());
    item.setPassed(passed);
    item.setVerdictSource(VerdictSource.AUTOMATIC);
    item.setManualVerdict(null);
  }

  private ChecklistTemplateItem definition(String sectionId, String itemId) {
    return template == null ? null : template.findItem(sectionId, itemId).orElse(null);
  }
}
