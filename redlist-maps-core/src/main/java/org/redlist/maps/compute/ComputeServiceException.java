package org.redlist.maps.compute;

import java.io.IOException;
import java.util.Locale;

/**
 * An error response from the remote compute service.
 */
public class ComputeServiceException extends IOException {

  private final int statusCode;

  public ComputeServiceException(int statusCode, String message) {
    super(message);
    this.statusCode = statusCode;
  }

  /** Returns the HTTP status code of the response. */
  public int statusCode() {
    return statusCode;
  }

  /** Returns true if the service rejected the caller's credentials or permissions. */
  public boolean isAuthError() {
    return statusCode == 401 || statusCode == 403;
  }

  /** Returns true if the request tried to create something that exists already. */
  public boolean isAlreadyExists() {
    return statusCode == 409 || String.valueOf(getMessage()).toLowerCase(Locale.ROOT).contains("already exists");
  }
}
