package com.codeheadsystems.vigil.model.device;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Qualitative device risk.
 */
public enum RiskLevel {
  LOW,
  MEDIUM,
  HIGH;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isAtLeast(RiskLevel other) {
    return compareTo(other) >= 0;
  }
}
