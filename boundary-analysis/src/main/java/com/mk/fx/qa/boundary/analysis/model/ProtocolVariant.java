package com.mk.fx.qa.boundary.analysis.model;

import java.util.Arrays;

/** The two protocol stacks under comparison. */
public enum ProtocolVariant {
  HTTP2("HTTP/2"),
  HTTP3("HTTP/3");

  private final String label;

  ProtocolVariant(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  public ProtocolVariant other() {
    return this == HTTP2 ? HTTP3 : HTTP2;
  }

  public static ProtocolVariant fromValue(String value) {
    return Arrays.stream(values())
        .filter(v -> v.name().equalsIgnoreCase(value) || v.label.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported protocol variant: " + value));
  }
}
