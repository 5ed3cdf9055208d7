package com.codeheadsystems.vigil.device.fingerprint;

import com.codeheadsystems.vigil.device.signal.SignalCategory;
import java.util.List;

/**
 * Weighted similarity between two fingerprints.
 *
 * @param similarity  weighted similarity in [0,1]
 * @param differences categories that differ, in category order
 */
public record FingerprintComparison(double similarity, List<SignalCategory> differences) {

  public FingerprintComparison {
    differences = List.copyOf(differences);
  }

  public boolean isSameDevice(double minimumSimilarity) {
    return similarity >= minimumSimilarity;
  }
}
