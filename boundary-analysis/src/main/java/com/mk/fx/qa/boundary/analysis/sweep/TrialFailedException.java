package com.mk.fx.qa.boundary.analysis.sweep;

/** A single benchmark trial produced no usable measurement. */
public class TrialFailedException extends RuntimeException {

  public TrialFailedException(String message) {
    super(message);
  }

  public TrialFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
