package com.shopfloor.backend.domain;

import java.time.OffsetDateTime;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

@Entity
@Table(
    name = "inspection_results",
    indexes = {
        @Index(name = "idx_inspection_order", columnList = "order_id"),
        @Index(name = "idx_inspection_checklist", columnList = "checklist_id")
    })
public class InspectionResultEntity {
  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "order_id", nullable = false)
  private String orderId;

  @Column(name = "item_id")
  private String itemId;

  @Column(name = "checklist_id", nullable = false, updatable = false)
  private Long checklistId;

  @Column(name = "checklist_name", updatable = false)
  private String checklistName;

  @Column(name = "inspector", nullable = false)
  private String inspector;

  @Column(name = "inspection_date")
  private OffsetDateTime inspectionDate;

  @Column(name = "status", nullable = false)
  private String status;

  @Column(name = "comments", columnDefinition = "TEXT")
  private String comments;

  @Column(name = "sections_json", columnDefinition = "TEXT", nullable = false)
  private String sectionsJson;

  @CreationTimestamp
  @Column(name = "created_at", updatable = false)
  private OffsetDateTime createdAt;

  @UpdateTimestamp
  @Column(name = "updated_at")
  private OffsetDateTime updatedAt;

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

  public String getStatus() {
    return status;
  }

  public void setStatus(String status) {
    this.status = status;
  }

  public String getComments() {
    return comments;
  }

  public void setComments(String comments) {
    this.comments = comments;
  }

  public String getSectionsJson() {
    return sectionsJson;
  }

  public void setSectionsJson(String sectionsJson) {
    this.sectionsJson = sectionsJson;
  }

  public OffsetDateTime getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(OffsetDateTime createdAt) {
    this.createdAt = createdAt;
  }

  public OffsetDateTime getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(OffsetDateTime updatedAt) {
    this.updatedAt = updatedAt;
  }
}
