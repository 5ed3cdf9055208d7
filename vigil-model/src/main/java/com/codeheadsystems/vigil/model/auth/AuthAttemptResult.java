package com.codeheadsystems.vigil.model.auth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of one authentication attempt.
 * <p>
 * On terminal outcomes exactly one of {@code sessionToken} and {@code errorKind} is set. A
 * pending push approval carries a {@code challengeToken} instead.
 *
 * @param method              the method that was attempted
 * @param success             whether a session was issued
 * @param state               the state the attempt ended in
 * @param errorKind           the failure reason, null on success
 * @param nextAction          hint for the caller
 * @param requiresNextAction  the method the caller should try next, null if none
 * @param sessionToken        the issued session token, null unless successful
 * @param challengeToken      the push challenge to await, null unless pending
 * @param lockoutRemaining    how long until the rate limit or lockout lifts, null if none
 * @param processingTime      time spent processing the attempt
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthAttemptResult(
    @JsonProperty("method") AuthMethod method,
    @JsonProperty("success") boolean success,
    @JsonProperty("state") AuthState state,
    @JsonProperty("errorKind") ErrorKind errorKind,
    @JsonProperty("nextAction") NextAction nextAction,
    @JsonProperty("requiresNextAction") AuthMethod requiresNextAction,
    @JsonProperty("sessionToken") String sessionToken,
    @JsonProperty("challengeToken") String challengeToken,
    @JsonProperty("lockoutRemaining") Duration lockoutRemaining,
    @JsonProperty("processingTime") Duration processingTime) {

  /**
   * Successful attempt.
   *
   * @param method         the method
   * @param sessionToken   the session token
   * @param processingTime the processing time
   * @return the result
   */
  public static AuthAttemptResult authenticated(AuthMethod method, String sessionToken,
                                                Duration processingTime) {
    return new AuthAttemptResult(method, true, AuthState.AUTHENTICATED, null, NextAction.NONE,
        null, sessionToken, null, null, processingTime);
  }

  /**
   * A challenge was issued out of band and the attempt now waits for it: a push approval or an
   * SMS code to be entered.
   *
   * @param method         the method
   * @param challengeToken the push challenge token, null for SMS
   * @param processingTime the processing time
   * @return the result
   */
  public static AuthAttemptResult awaitingVerification(AuthMethod method, String challengeToken,
                                                       Duration processingTime) {
    NextAction hint = method == AuthMethod.PUSH ? NextAction.AWAIT_APPROVAL : NextAction.ENTER_CODE;
    return new AuthAttemptResult(method, false, AuthState.AWAITING_VERIFICATION, null, hint,
        null, null, challengeToken, null, processingTime);
  }

  /**
   * Unsuccessful attempt.
   *
   * @param method             the method
   * @param state              the state
   * @param errorKind          the error kind
   * @param nextAction         the next action
   * @param requiresNextAction the next method, may be null
   * @param lockoutRemaining   the remaining lockout, may be null
   * @param processingTime     the processing time
   * @return the result
   */
  public static AuthAttemptResult failure(AuthMethod method, AuthState state, ErrorKind errorKind,
                                          NextAction nextAction, AuthMethod requiresNextAction,
                                          Duration lockoutRemaining, Duration processingTime) {
    return new AuthAttemptResult(method, false, state, errorKind, nextAction, requiresNextAction,
        null, null, lockoutRemaining, processingTime);
  }

  public Optional<AuthMethod> nextMethod() {
    return Optional.ofNullable(requiresNextAction);
  }
}
