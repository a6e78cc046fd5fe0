package tech.tessera.identity.credential;

/**
 * Request-side routing data needed to build a reset link.
 *
 * @param serverUrl base URL of the API that redeems the token
 * @param host      host of the front end serving the reset page
 */
public record ResetLinkContext(String serverUrl, String host) {
}
