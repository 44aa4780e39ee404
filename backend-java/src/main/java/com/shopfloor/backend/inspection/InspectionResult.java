package com.shopfloor.backend.inspection;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One inspection of an order (optionally a single order item) against a checklist template.
 *
 * <p>{@code id} stays null until the inspection is persisted. {@code checklistId} and
 * {@code checklistName} are fixed when the template is bound; once {@code id} is set the section
 * shape is fixed as well. {@code status} is only ever written by {@link StatusDeriver}.
 */
public class InspectionResult {
  private Long id;
  private String orderId;
  private String itemId;
  private Long checklistId;
  private String checklistName;
  private String inspector;
  private OffsetDateTime inspectionDate;
  private InspectionStatus status = InspectionStatus.PASSED;
  private String comments;
  private List<InspectionResultSection> sections = new ArrayList<>();

  public Long getId() {
    return id;
  }

  public void setId(Long id) {
    this.id = id;
  }

  public String getOrderId() {
    return orderId;
  }

  public void setOrderId(String orderId) {
    this.orderId = orderId;
  }

  public String getItemId() {
    return itemId;
  }

  public void setItemId(String itemId) {
    this.itemId = itemId;
  }

  public Long getChecklistId() {
    return checklistId;
  }

  public void setChecklistId(Long checklistId) {
    this.checklistId = checklistId;
  }

  public String getChecklistName() {
    return checklistName;
  }

  public void setChecklistName(String checklistName) {
    this.checklistName = checklistName;
  }

  public String getInspector() {
    return inspector;
  }

  public void setInspector(String inspector) {
    this.inspector = inspector;
  }

  public OffsetDateTime getInspectionDate() {
    return inspectionDate;
  }

  public void setInspectionDate(OffsetDateTime inspectionDate) {
    this.inspectionDate = inspectionDate;
  }

  public InspectionStatus getStatus() {
    return status;
  }

  void setStatus(InspectionStatus status) {
    this.status = status;
  }

  public String getComments() {
    return comments;
  }

  public void setComments(String comments) {
    this.comments = comments;
  }

  public List<InspectionResultSection> getSections() {
    return sections;
  }

  public void setSections(List<InspectionResultSection> sections) {
    this.sections = sections == null ? new ArrayList<>() : new ArrayList<>(sections);
  }

  @JsonIgnore
  public boolean isPersisted() {
    return id != null;
  }

  public List<InspectionResultItem> allItems() {
    return sections.stream().flatMap(s -> s.getItems().stream()).toList();
  }

  public Optional<InspectionResultItem> findItem(String sectionId, String itemId) {
    return sections.stream()
        .filter(s -> s.getId() != null && s.getId().equals(sectionId))
        .findFirst()
        .flatMap(s -> s.getItems().stream()
            .filter(i -> i.getId() != null && i.getId().equals(itemId))
            .findFirst());
  }
}
