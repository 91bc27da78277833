package org.redlist.maps.compute;

import java.io.IOException;
import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that the compute service accepts the configured credentials by listing the project's assets.
 * <p>
 * Failures are reported in the returned {@link AuthStatus}, never thrown.
 */
public class AuthCheck {

  private static final Logger LOGGER = LoggerFactory.getLogger(AuthCheck.class);

  public static final String SUCCESS_MESSAGE = "Successfully authenticated to Earth Engine";

  private AuthCheck() {}

  public static AuthStatus check(ComputeService service) {
    if (!service.hasCredentials()) {
      return new AuthStatus(false,
        "No Earth Engine credentials configured, set ee_access_token (or REDLIST_EE_ACCESS_TOKEN) to an OAuth2 " +
          "access token, for example from 'gcloud auth print-access-token'", null);
    }
    try {
      service.listAssets(null);
      return new AuthStatus(true, SUCCESS_MESSAGE, service.project());
    } catch (ComputeServiceException e) {
      LOGGER.debug("Authentication check failed", e);
      if (e.isAuthError()) {
        return new AuthStatus(false, "Earth Engine authentication failed: " + e.getMessage(), null);
      }
      return new AuthStatus(false, "Authentication error: " + e.getMessage(), null);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return new AuthStatus(false, "Authentication error: interrupted", null);
    } catch (IOException | RuntimeException e) {
      LOGGER.debug("Authentication check failed", e);
      return new AuthStatus(false, "Authentication error: " + e, null);
    }
  }

  public static boolean isAuthenticated(ComputeService service) {
    return check(service).authenticated();
  }

  /** Prints a human-readable report of {@link #check(ComputeService)} to {@code out}. */
  public static AuthStatus printStatus(ComputeService service, PrintStream out) {
    AuthStatus status = check(service);
    if (status.authenticated()) {
      out.println("Earth Engine Authentication: SUCCESS");
      out.println("  Message: " + status.message());
      if (status.project() != null) {
        out.println("  Project: " + status.project());
      }
    } else {
      out.println("Earth Engine Authentication: FAILED");
      out.println("  Message: " + status.message());
      out.println();
      out.println("To authenticate, run:");
      out.println("  gcloud auth application-default login");
      out.println("and pass the token with:");
      out.println("  --ee_access_token=$(gcloud auth print-access-token) --ee_project=<project>");
    }
    return status;
  }
}
