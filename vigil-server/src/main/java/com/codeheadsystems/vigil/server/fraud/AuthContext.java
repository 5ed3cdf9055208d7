package com.codeheadsystems.vigil.server.fraud;

import com.codeheadsystems.vigil.model.auth.AuthMethod;
import com.codeheadsystems.vigil.model.device.DeviceRiskAssessment;
import java.util.Map;

/**
 * Context handed to a {@link FraudSignalAssessor}.
 *
 * @param method     the method being attempted
 * @param attributes request attributes such as the remote address
 * @param deviceRisk device risk of the attempt, null if no signals were supplied
 */
public record AuthContext(AuthMethod method,
                          Map<String, String> attributes,
                          DeviceRiskAssessment deviceRisk) {

  public AuthContext {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }
}
