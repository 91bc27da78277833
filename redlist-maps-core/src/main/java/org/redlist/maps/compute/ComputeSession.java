package org.redlist.maps.compute;

import org.apache.commons.lang3.StringUtils;
import org.redlist.maps.config.MapsConfig;

/**
 * Credentials and endpoint used to call the remote compute service.
 *
 * @param baseUrl     REST endpoint root, without a trailing slash
 * @param project     cloud project id, or {@code null}
 * @param accessToken OAuth2 bearer token, or {@code null}
 */
public record ComputeSession(String baseUrl, String project, String accessToken) {

  public ComputeSession {
    baseUrl = StringUtils.removeEnd(baseUrl, "/");
  }

  public static ComputeSession from(MapsConfig config) {
    return new ComputeSession(config.earthEngineBaseUrl(), config.earthEngineProject(),
      config.earthEngineAccessToken());
  }

  public boolean hasCredentials() {
    return StringUtils.isNotBlank(accessToken);
  }

  @Override
  public String toString() {
    // never log the token
    return "ComputeSession{baseUrl=" + baseUrl + ", project=" + project + ", token=" +
      (hasCredentials() ? "***" : "none") + "}";
  }
}
