package com.shopfloor.backend.dto;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.shopfloor.backend.config.LenientOffsetDateTimeDeserializer;
import com.shopfloor.backend.inspection.InspectionResult;
import com.shopfloor.backend.inspection.InspectionStatus;
import com.shopfloor.backend.inspection.Verdict;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public final class InspectionDtos {
  private InspectionDtos() {}

  public record InspectionDraftIn(
      @NotNull Long checklistId,
      String orderId,
      String itemId,
      String inspector,
      @JsonDeserialize(using = LenientOffsetDateTimeDeserializer.class)
      OffsetDateTime inspectionDate
  ) {}

  public record DraftRebindIn(
      @NotNull InspectionResult inspection,
      @NotNull Long checklistId
  ) {}

  public record DraftItemValueIn(
      @NotNull InspectionResult inspection,
      @NotBlank String sectionId,
      @NotBlank String itemId,
      Object value
  ) {}

  public record DraftItemVerdictIn(
      @NotNull InspectionResult inspection,
      @NotBlank String sectionId,
      @NotBlank String itemId,
      @NotNull Verdict verdict
  ) {}

  public record DraftItemCommentIn(
      @NotNull InspectionResult inspection,
      @NotBlank String sectionId,
      @NotBlank String itemId,
      String comments
  ) {}

  public record ItemValueIn(
      @NotBlank String sectionId,
      @NotBlank String itemId,
      Object value
  ) {}

  public record ItemVerdictIn(
      @NotBlank String sectionId,
      @NotBlank String itemId,
      @NotNull Verdict verdict
  ) {}

  public record ItemCommentIn(
      @NotBlank String sectionId,
      @NotBlank String itemId,
      String comments
  ) {}

  public record InspectionListOut(
      long id,
      String orderId,
      String itemId,
      long checklistId,
      String checklistName,
      String inspector,
      OffsetDateTime inspectionDate,
      InspectionStatus status,
      int passedItems,
      int totalItems
  ) {}
}
