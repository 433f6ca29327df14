package com.mk.fx.qa.boundary.analysis.sweep;

public class NetworkShapingException extends RuntimeException {

  public NetworkShapingException(String message) {
    super(message);
  }

  public NetworkShapingException(String message, Throwable cause) {
    super(message, cause);
  }
}
