package com.shopfloor.backend.inspection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Which path last wrote an item's {@code passed} flag. */
public enum VerdictSource {
  AUTOMATIC("automatic"),
  MANUAL("manual");

  private final String wire;

  VerdictSource(String wire) {
    this.wire = wire;
  }

  @JsonValue
  public String wire() {
    return wire;
  }

  @JsonCreator
  public static VerdictSource fromWire(String raw) {
    return "manual".equalsIgnoreCase(raw == null ? "" : raw.trim()) ? MANUAL : AUTOMATIC;
  }
}
