package com.opensciencecatalog.backend.submission;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeKind {
  ADD("Add"),
  UPDATE("Update"),
  DELETE("Delete");

  private final String wireValue;

  ChangeKind(String wireValue) {
    this.wireValue = wireValue;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }

  @JsonCreator
  public static ChangeKind fromWireValue(String value) {
    for (ChangeKind kind : values()) {
      if (kind.wireValue.equals(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown change type: " + value);
  }
}
