package com.shopfloor.backend.inspection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Aggregate outcome of an inspection. Always derived by {@link StatusDeriver}. */
public enum InspectionStatus {
  PASSED("passed"),
  PARTIAL("partial"),
  FAILED("failed");

  private final String wire;

  InspectionStatus(String wire) {
    this.wire = wire;
  }

  @JsonValue
  public String wire() {
    return wire;
  }

  @JsonCreator
  public static InspectionStatus fromWire(String raw) {
    String t = raw == null ? "" : raw.trim().toLowerCase();
    for (InspectionStatus s : values()) {
      if (s.wire.equals(t)) {
        return s;
      }
    }
    throw new IllegalArgumentException("invalid inspection status: " + raw);
  }
}
