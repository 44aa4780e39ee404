package com.shopfloor.backend.service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.shopfloor.backend.domain.InspectionResultEntity;
import com.shopfloor.backend.dto.InspectionDtos.InspectionDraftIn;
import com.shopfloor.backend.inspection.ChecklistTemplate;
import com.shopfloor.backend.inspection.InspectionEditor;
import com.shopfloor.backend.inspection.InspectionResult;
import com.shopfloor.backend.inspection.InspectionResultItem;
import com.shopfloor.backend.inspection.StatusDeriver;
import com.shopfloor.backend.repo.InspectionResultRepository;
import com.shopfloor.backend.util.UploadRefNormalizer;

@Service
public class InspectionService {
  private static final Logger logger = LoggerFactory.getLogger(InspectionService.class);

  private final InspectionResultRepository inspectionRepository;
  private final ChecklistTemplateService templateService;
  private final SectionTreeCodec codec;

  public InspectionService(
      InspectionResultRepository inspectionRepository,
      ChecklistTemplateService templateService,
      SectionTreeCodec codec) {
    this.inspectionRepository = inspectionRepository;
    this.templateService = templateService;
    this.codec = codec;
  }

  /** New unsaved inspection bound to the given checklist, or null when the checklist does not exist. */
  @Transactional(readOnly = true)
  public InspectionResult newDraft(InspectionDraftIn payload) {
    ChecklistTemplate template = templateService.get(payload.checklistId());
    if (template == null) {
      return null;
    }
    OffsetDateTime date = payload.inspectionDate() == null ? OffsetDateTime.now() : payload.inspectionDate();
    return InspectionEditor.start(template, payload.orderId(), payload.itemId(), payload.inspector(), date)
        .inspection();
  }

  /** Editing session for an inspection held by the caller, bound to its current checklist if it still exists. */
  @Transactional(readOnly = true)
  public InspectionEditor editorFor(InspectionResult inspection) {
    ChecklistTemplate template = inspection.getChecklistId() == null
        ? null
        : templateService.get(inspection.getChecklistId());
    return new InspectionEditor(inspection, template);
  }

  @Transactional(readOnly = true)
  public ChecklistTemplate template(long checklistId) {
    return templateService.get(checklistId);
  }

  @Transactional(readOnly = true)
  public InspectionResult get(long inspectionId) {
    return inspectionRepository.findById(inspectionId).map(this::toModel).orElse(null);
  }

  @Transactional(readOnly = true)
  public List<InspectionResult> list(String orderId, String itemId, int limit) {
    int safeLimit = Math.max(1, Math.min(limit <= 0 ? 100 : limit, 500));
    var pageable = PageRequest.of(0, safeLimit);

    boolean hasOrder = orderId != null && !orderId.trim().isEmpty();
    boolean hasItem = itemId != null && !itemId.trim().isEmpty();

    List<InspectionResultEntity> rows;
    if (hasOrder && hasItem) {
      rows = inspectionRepository.findByOrderIdAndItemIdOrderByInspectionDateDescIdDesc(orderId.trim(), itemId.trim(), pageable);
    } else if (hasOrder) {
      rows = inspectionRepository.findByOrderIdOrderByInspectionDateDescIdDesc(orderId.trim(), pageable);
    } else {
      rows = inspectionRepository.findAllByOrderByInspectionDateDescIdDesc(pageable);
    }
    return rows.stream().map(this::toModel).toList();
  }

  /**
   * Creates (no id) or updates (existing id) the stored snapshot. New inspections are bound to their
   * checklist here; updates keep the stored binding and section shape. In both cases only item
   * values, manual verdicts, comments, photos and the header fields are taken from {@code incoming},
   * and every automatic verdict is judged again against the checklist.
   *
   * @return the stored inspection, or null when an update targets an unknown id
   * @throws InspectionValidationException when required fields are missing or the checklist of a new
   *     inspection does not exist
   */
  @Transactional
  public InspectionResult save(InspectionResult incoming) {
    InspectionValidator.requireValid(incoming);
    normalizePhotos(incoming);

    if (!incoming.isPersisted()) {
      ChecklistTemplate template = templateService.get(incoming.getChecklistId());
      if (template == null) {
        throw new InspectionValidationException(List.of("checklist " + incoming.getChecklistId() + " does not exist"));
      }
      InspectionEditor editor = InspectionEditor.start(
          template,
          incoming.getOrderId().trim(),
          trimOrNull(incoming.getItemId()),
          incoming.getInspector(),
          incoming.getInspectionDate());
      editor.adoptRecorded(incoming);

      InspectionResultEntity row = new InspectionResultEntity();
      row.setOrderId(editor.inspection().getOrderId());
      row.setItemId(editor.inspection().getItemId());
      row.setChecklistId(template.id());
      row.setChecklistName(template.name());
      applyHeader(row, incoming);
      applySections(row, editor.inspection());
      row = inspectionRepository.save(row);
      logger.info("Created inspection {} for order {} with status {}", row.getId(), row.getOrderId(), row.getStatus());
      return toModel(row);
    }

    InspectionResultEntity row = inspectionRepository.findById(incoming.getId()).orElse(null);
    if (row == null) {
      return null;
    }
    if (!Objects.equals(row.getChecklistId(), incoming.getChecklistId())) {
      logger.warn("Inspection {} is bound to checklist {}; ignoring checklist {} in update",
          row.getId(), row.getChecklistId(), incoming.getChecklistId());
    }

    InspectionEditor editor = editorFor(toModel(row));
    editor.adoptRecorded(incoming);
    applyHeader(row, incoming);
    applySections(row, editor.inspection());
    row = inspectionRepository.save(row);
    logger.info("Updated inspection {} with status {}", row.getId(), row.getStatus());
    return toModel(row);
  }

  /**
   * Runs one editing step against a stored inspection and writes the result back.
   *
   * @return the updated inspection, or null when {@code inspectionId} is unknown
   * @throws IllegalArgumentException when the step addresses an item the inspection does not have
   */
  @Transactional
  public InspectionResult edit(long inspectionId, Function<InspectionEditor, Optional<InspectionResultItem>> step) {
    InspectionResultEntity row = inspectionRepository.findById(inspectionId).orElse(null);
    if (row == null) {
      return null;
    }
    InspectionEditor editor = editorFor(toModel(row));
    if (step.apply(editor).isEmpty()) {
      throw new IllegalArgumentException("unknown section or item");
    }
    applySections(row, editor.inspection());
    row = inspectionRepository.save(row);
    return toModel(row);
  }

  @Transactional
  public boolean delete(long inspectionId) {
    if (!inspectionRepository.existsById(inspectionId)) {
      return false;
    }
    inspectionRepository.deleteById(inspectionId);
    logger.info("Deleted inspection {}", inspectionId);
    return true;
  }

  private static void normalizePhotos(InspectionResult inspection) {
    for (InspectionResultItem item : inspection.allItems()) {
      item.setPhotos(item.getPhotos().stream()
          .map(UploadRefNormalizer::normalize)
          .filter(p -> p != null && !p.isBlank())
          .toList());
    }
  }

  private void applyHeader(InspectionResultEntity row, InspectionResult in) {
    row.setInspector(in.getInspector().trim());
    row.setInspectionDate(in.getInspectionDate() == null ? OffsetDateTime.now() : in.getInspectionDate());
    row.setComments(in.getComments());
  }

  private void applySections(InspectionResultEntity row, InspectionResult model) {
    row.setSectionsJson(codec.writeResultSections(model.getSections()));
    row.setStatus(model.getStatus().wire());
  }

  private InspectionResult toModel(InspectionResultEntity row) {
    InspectionResult r = new InspectionResult();
    r.setId(row.getId());
    r.setOrderId(row.getOrderId());
    r.setItemId(row.getItemId());
    r.setChecklistId(row.getChecklistId());
    r.setChecklistName(row.getChecklistName());
    r.setInspector(row.getInspector());
    r.setInspectionDate(row.getInspectionDate());
    r.setComments(row.getComments());
    r.setSections(codec.readResultSections(row.getSectionsJson()));
    StatusDeriver.refresh(r);
    return r;
  }

  private static String trimOrNull(String s) {
    if (s == null) {
      return null;
    }
    String t = s.trim();
    return t.isEmpty() ? null : t;
  }
}
