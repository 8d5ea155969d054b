package com.mk.fx.qa.rivet.rest;

import lombok.Getter;

/**
 * Raised when a request could not complete at the transport level. A response with a non-2xx
 * status is not a transport failure and never produces this exception.
 */
@Getter
public class TransportException extends Exception {

  /** Transport failure classes. */
  public enum Kind {
    /** Connection refused, reset, unknown host or TLS handshake failure. */
    CONNECTION,
    /** No response within the request timeout. */
    TIMEOUT,
    /** Malformed request or response, unsupported protocol feature. */
    PROTOCOL
  }

  private final Kind kind;

  public TransportException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public TransportException(Kind kind, String message) {
    this(kind, message, null);
  }
}
