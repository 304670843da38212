package com.minishop.apigateway.error;

import lombok.Getter;

/**
 * A forwarded call failed: the backend was unreachable, too slow, or answered with an error
 * status. {@code status} is that error status, or 0 when no response arrived.
 */
@Getter
public class UpstreamException extends RuntimeException {

  private final int status;

  public UpstreamException(int status, String message, Throwable cause) {
    super(message, cause);
    this.status = status;
  }

  public boolean isNotFound() {
    return status == 404;
  }
}
