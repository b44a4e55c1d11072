package com.policyguard.backend.github;

/** Raised when the App assertion cannot be signed or exchanged for an installation token. */
public class CredentialException extends RuntimeException {

  public CredentialException(String message) {
    super(message);
  }

  public CredentialException(String message, Throwable cause) {
    super(message, cause);
  }
}
