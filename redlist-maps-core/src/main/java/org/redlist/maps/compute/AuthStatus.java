package org.redlist.maps.compute;

/**
 * Result of checking whether the compute service accepts the configured credentials.
 *
 * @param authenticated true if an authenticated request succeeded
 * @param message       human-readable description of the outcome
 * @param project       the project the credentials were checked against, or {@code null}
 */
public record AuthStatus(boolean authenticated, String message, String project) {}
