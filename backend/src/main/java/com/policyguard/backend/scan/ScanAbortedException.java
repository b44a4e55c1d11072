package com.policyguard.backend.scan;

/** Raised when a running scan is cancelled or runs past its configured deadline. */
public class ScanAbortedException extends RuntimeException {

  public ScanAbortedException(String message) {
    super(message);
  }
}
