package com.shopfloor.backend.inspection;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a checklist item. Each kind carries its own expected-value shape and comparison rule,
 * see {@link ItemEvaluator}.
 */
public enum ItemType {
  BOOLEAN("boolean"),
  NUMERIC("numeric"),
  TEXT("text");

  private final String wire;

  ItemType(String wire) {
    this.wire = wire;
  }

  @JsonValue
  public String wire() {
    return wire;
  }

  @JsonCreator
  public static ItemType fromWire(String raw) {
    String t = raw == null ? "" : raw.trim().toLowerCase();
    for (ItemType type : values()) {
      if (type.wire.equals(t)) {
        return type;
      }
    }
    throw new IllegalArgumentException("invalid item type: " + raw);
  }
}
