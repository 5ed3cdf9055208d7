package com.codeheadsystems.vigil.device.risk;

/**
 * Device risk indicators and their additive weights, in hundredths.
 */
public enum RiskIndicator {
  ANONYMITY_TOOL(30, "Privacy or anonymity tools detected"),
  LOW_RESOLUTION(20, "Uncommon screen resolution"),
  LOW_CONFIDENCE(30, "Low fingerprint confidence - possible bot"),
  HARDWARE_MEMORY_UNAVAILABLE(10, "Hardware information unavailable"),
  RENDER_ENGINE_UNAVAILABLE(10, "Rendering engine not available");

  private final int weight;
  private final String reason;

  RiskIndicator(int weight, String reason) {
    this.weight = weight;
    this.reason = reason;
  }

  public int weight() {
    return weight;
  }

  public String reason() {
    return reason;
  }
}
