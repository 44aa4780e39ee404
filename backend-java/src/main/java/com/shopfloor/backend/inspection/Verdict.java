package com.shopfloor.backend.inspection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verdict an inspector can set directly on an item. {@code REWORK} fails the item exactly like
 * {@code REJECTED}; the two only differ in how reports label them.
 */
public enum Verdict {
  APPROVED("approved"),
  REJECTED("rejected"),
  REWORK("rework");

  private final String wire;

  Verdict(String wire) {
    this.wire = wire;
  }

  @JsonValue
  public String wire() {
    return wire;
  }

  public boolean passes() {
    return this == APPROVED;
  }

  @JsonCreator
  public static Verdict fromWire(String raw) {
    String t = raw == null ? "" : raw.trim().toLowerCase();
    for (Verdict v : values()) {
      if (v.wire.equals(t)) {
        return v;
      }
    }
    throw new IllegalArgumentException("invalid verdict: " + raw);
  }
}
