package com.shopfloor.backend.service;

import java.util.List;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopfloor.backend.inspection.ChecklistTemplateSection;
import com.shopfloor.backend.inspection.InspectionResultSection;

/** Section trees are stored as JSON in TEXT columns. */
@Component
public class SectionTreeCodec {
  private static final TypeReference<List<ChecklistTemplateSection>> TEMPLATE_SECTIONS = new TypeReference<>() {};
  private static final TypeReference<List<InspectionResultSection>> RESULT_SECTIONS = new TypeReference<>() {};
  private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public SectionTreeCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public String writeTemplateSections(List<ChecklistTemplateSection> sections) {
    return write(sections == null ? List.of() : sections);
  }

  public List<ChecklistTemplateSection> readTemplateSections(String json) {
    return read(json, TEMPLATE_SECTIONS);
  }

  public String writeResultSections(List<InspectionResultSection> sections) {
    return write(sections == null ? List.of() : sections);
  }

  public List<InspectionResultSection> readResultSections(String json) {
    return read(json, RESULT_SECTIONS);
  }

  public String writeStrings(List<String> values) {
    return values == null || values.isEmpty() ? null : write(values);
  }

  public List<String> readStrings(String json) {
    return read(json, STRINGS);
  }

  private String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("cannot serialize section tree", e);
    }
  }

  private <T> List<T> read(String json, TypeReference<List<T>> type) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      List<T> out = objectMapper.readValue(json, type);
      return out == null ? List.of() : out;
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("stored section tree is not valid JSON", e);
    }
  }
}
