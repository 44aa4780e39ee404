package com.shopfloor.backend.inspection;

import java.util.ArrayList;
import java.util.List;

public class InspectionResultSection {
  private String id;
  private String name;
  private List<InspectionResultItem> items = new ArrayList<>();

  public InspectionResultSection() {}

  public InspectionResultSection(String id, String name, List<InspectionResultItem> items) {
    this.id = id;
    this.name = name;
    setItems(items);
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public List<InspectionResultItem> getItems() {
    return items;
  }

  public void setItems(List<InspectionResultItem> items) {
    this.items = items == null ? new ArrayList<>() : new ArrayList<>(items);
  }
}
