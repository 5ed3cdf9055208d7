package com.codeheadsystems.vigil.model.auth;

/**
 * Hint for the presentation layer on how to react to a non-successful outcome, so that it does
 * not have to inspect {@link ErrorKind}.
 */
public enum NextAction {
  RETRY,
  CORRECT_INPUT,
  SWITCH_METHOD,
  WAIT,
  AWAIT_APPROVAL,
  ENTER_CODE,
  REQUEST_NEW_CHALLENGE,
  CONTACT_SUPPORT,
  NONE
}
