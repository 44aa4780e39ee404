package com.shopfloor.backend.inspection;

import java.util.ArrayList;
import java.util.List;

/**
 * Recorded outcome for one template item. {@code description} and {@code criticalItem} are copies
 * taken when the inspection was bound, so later template edits do not leak into existing results.
 *
 * <p>{@code result} holds a {@link Boolean}, {@link Number} or {@link String}. {@code passed} is the
 * last verdict written either by {@link ItemEvaluator} or by a manual {@link Verdict};
 * {@code verdictSource} and {@code manualVerdict} say which.
 */
public class InspectionResultItem {
  private String id;
  private String description;
  private Object result;
  private boolean passed;
  private boolean criticalItem;
  private String comments;
  private List<String> photos = new ArrayList<>();
  private VerdictSource verdictSource = VerdictSource.AUTOMATIC;
  private Verdict manualVerdict;

  public InspectionResultItem() {}

  public InspectionResultItem(String id, String description, Object result, boolean criticalItem) {
    this.id = id;
    this.description = description;
    this.result = result;
    this.criticalItem = criticalItem;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public Object getResult() {
    return result;
  }

  public void setResult(Object result) {
    this.result = result;
  }

  public boolean isPassed() {
    return passed;
  }

  public void setPassed(boolean passed) {
    this.passed = passed;
  }

  public boolean isCriticalItem() {
    return criticalItem;
  }

  public void setCriticalItem(boolean criticalItem) {
    this.criticalItem = criticalItem;
  }

  public String getComments() {
    return comments;
  }

  public void setComments(String comments) {
    this.comments = comments;
  }

  public List<String> getPhotos() {
    return photos;
  }

  public void setPhotos(List<String> photos) {
    this.photos = photos == null ? new ArrayList<>() : new ArrayList<>(photos);
  }

  public VerdictSource getVerdictSource() {
    return verdictSource;
  }

  public void setVerdictSource(VerdictSource verdictSource) {
    this.verdictSource = verdictSource == null ? VerdictSource.AUTOMATIC : verdictSource;
  }

  public Verdict getManualVerdict() {
    return manualVerdict;
  }

  public void setManualVerdict(Verdict manualVerdict) {
    this.manualVerdict = manualVerdict;
  }
}
