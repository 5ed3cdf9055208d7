package com.codeheadsystems.vigil.server.verifier;

import com.codeheadsystems.vigil.model.auth.AuthIdentity;

/**
 * Delivers push approval requests to the identity's registered devices.
 */
public interface PushDispatcher {

  /**
   * Dispatches a push challenge.
   *
   * @param identity the identity
   * @param payload  the payload
   * @return the dispatch result
   */
  DispatchResult dispatch(AuthIdentity identity, PushPayload payload);

  /**
   * Whether dispatch succeeded.
   *
   * @param success true if at least one device was reached
   * @param error   provider error description, null on success
   */
  record DispatchResult(boolean success, String error) {

    public static DispatchResult delivered() {
      return new DispatchResult(true, null);
    }

    public static DispatchResult failed(String error) {
      return new DispatchResult(false, error);
    }
  }
}
