package com.shopfloor.backend.api;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.shopfloor.backend.dto.InspectionDtos.DraftItemCommentIn;
import com.shopfloor.backend.dto.InspectionDtos.DraftItemValueIn;
import com.shopfloor.backend.dto.InspectionDtos.DraftItemVerdictIn;
import com.shopfloor.backend.dto.InspectionDtos.DraftRebindIn;
import com.shopfloor.backend.dto.InspectionDtos.InspectionDraftIn;
import com.shopfloor.backend.dto.InspectionDtos.InspectionListOut;
import com.shopfloor.backend.dto.InspectionDtos.ItemCommentIn;
import com.shopfloor.backend.dto.InspectionDtos.ItemValueIn;
import com.shopfloor.backend.dto.InspectionDtos.ItemVerdictIn;
import com.shopfloor.backend.inspection.InspectionEditor;
import com.shopfloor.backend.inspection.InspectionResult;
import com.shopfloor.backend.inspection.InspectionResultItem;
import com.shopfloor.backend.inspection.InspectionSummary;
import com.shopfloor.backend.service.InspectionService;

import jakarta.validation.Valid;

@RestController
public class InspectionController {
  private final InspectionService inspectionService;

  public InspectionController(InspectionService inspectionService) {
    this.inspectionService = inspectionService;
  }

  @PostMapping("/v1/inspections/drafts")
  public InspectionResult createDraft(@Valid @RequestBody InspectionDraftIn payload) {
    var draft = inspectionService.newDraft(payload);
    if (draft == null) {
      throw new ApiNotFoundException("checklist template not found");
    }
    return draft;
  }

  @PostMapping("/v1/inspections/drafts/rebind")
  public InspectionResult rebindDraft(@Valid @RequestBody DraftRebindIn payload) {
    var template = inspectionService.template(payload.checklistId());
    if (template == null) {
      throw new ApiNotFoundException("checklist template not found");
    }
    InspectionEditor editor = inspectionService.editorFor(payload.inspection());
    editor.selectTemplate(template);
    return editor.inspection();
  }

  @PostMapping("/v1/inspections/drafts/record")
  public InspectionResult recordDraftValue(@Valid @RequestBody DraftItemValueIn payload) {
    return onDraft(payload.inspection(), e -> e.recordValue(payload.sectionId(), payload.itemId(), payload.value()));
  }

  @PostMapping("/v1/inspections/drafts/verdict")
  public InspectionResult setDraftVerdict(@Valid @RequestBody DraftItemVerdictIn payload) {
    return onDraft(payload.inspection(), e -> e.setVerdict(payload.sectionId(), payload.itemId(), payload.verdict()));
  }

  @PostMapping("/v1/inspections/drafts/comment")
  public InspectionResult setDraftComment(@Valid @RequestBody DraftItemCommentIn payload) {
    return onDraft(payload.inspection(), e -> e.setItemComment(payload.sectionId(), payload.itemId(), payload.comments()));
  }

  @PostMapping("/v1/inspections")
  public Map<String, Object> saveInspection(@RequestBody InspectionResult payload) {
    var saved = inspectionService.save(payload);
    if (saved == null) {
      throw new ApiNotFoundException("inspection not found");
    }
    return Map.of("id", saved.getId(), "status", saved.getStatus());
  }

  @GetMapping("/v1/inspections")
  public List<InspectionListOut> listInspections(
      @RequestParam(name = "order_id", required = false) String orderId,
      @RequestParam(name = "item_id", required = false) String itemId,
      @RequestParam(name = "limit", defaultValue = "100") int limit) {
    return inspectionService.list(orderId, itemId, limit).stream()
        .map(r -> {
          var summary = InspectionSummary.of(r);
          return new InspectionListOut(
              r.getId(),
              r.getOrderId(),
              r.getItemId(),
              r.getChecklistId(),
              r.getChecklistName(),
              r.getInspector(),
              r.getInspectionDate(),
              r.getStatus(),
              summary.passed(),
              summary.total()
          );
        })
        .toList();
  }

  @GetMapping("/v1/inspections/{inspectionId}")
  public InspectionResult getInspection(@PathVariable("inspectionId") long inspectionId) {
    return found(inspectionService.get(inspectionId));
  }

  @GetMapping("/v1/inspections/{inspectionId}/summary")
  public InspectionSummary summary(@PathVariable("inspectionId") long inspectionId) {
    return InspectionSummary.of(found(inspectionService.get(inspectionId)));
  }

  @PostMapping("/v1/inspections/{inspectionId}/record")
  public InspectionResult recordValue(@PathVariable("inspectionId") long inspectionId, @Valid @RequestBody ItemValueIn payload) {
    return found(inspectionService.edit(inspectionId, e -> e.recordValue(payload.sectionId(), payload.itemId(), payload.value())));
  }

  @PostMapping("/v1/inspections/{inspectionId}/verdict")
  public InspectionResult setVerdict(@PathVariable("inspectionId") long inspectionId, @Valid @RequestBody ItemVerdictIn payload) {
    return found(inspectionService.edit(inspectionId, e -> e.setVerdict(payload.sectionId(), payload.itemId(), payload.verdict())));
  }

  @PostMapping("/v1/inspections/{inspectionId}/comment")
  public InspectionResult setComment(@PathVariable("inspectionId") long inspectionId, @Valid @RequestBody ItemCommentIn payload) {
    return found(inspectionService.edit(inspectionId, e -> e.setItemComment(payload.sectionId(), payload.itemId(), payload.comments())));
  }

  @DeleteMapping("/v1/inspections/{inspectionId}")
  public Map<String, Object> deleteInspection(@PathVariable("inspectionId") long inspectionId) {
    if (!inspectionService.delete(inspectionId)) {
      throw new ApiNotFoundException("inspection not found");
    }
    return Map.of("id", inspectionId, "deleted", true);
  }

  private InspectionResult onDraft(InspectionResult draft, Function<InspectionEditor, Optional<InspectionResultItem>> step) {
    InspectionEditor editor = inspectionService.editorFor(draft);
    if (step.apply(editor).isEmpty()) {
      throw new IllegalArgumentException("unknown section or item");
    }
    return editor.inspection();
  }

  private static InspectionResult found(InspectionResult r) {
    if (r == null) {
      throw new ApiNotFoundException("inspection not found");
    }
    return r;
  }
}
