package com.codeheadsystems.hubauth.client.accessor;

import com.codeheadsystems.hubauth.client.exceptions.HubCredentialRejectedException;
import com.codeheadsystems.hubauth.client.exceptions.HubRequestRejectedException;
import com.codeheadsystems.hubauth.client.exceptions.HubUnavailableException;
import com.codeheadsystems.hubauth.client.model.HubConnectionInfo;
import com.codeheadsystems.hubauth.model.AuthorizationRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the hub's cookie authorization endpoint.
 * <p>
 * Issues exactly one {@code GET {apiUrl}/authorizations/cookie/{cookieName}/{cookieValue}} per call,
 * authenticated with {@code Authorization: token {apiKey}}, and classifies the answer:
 * <ul>
 *   <li>404: the cookie is unknown or expired; returns empty.</li>
 *   <li>403: our own API token is rejected; {@link HubCredentialRejectedException}, logged at ERROR.</li>
 *   <li>5xx, I/O failure, timeout: {@link HubUnavailableException}, logged at ERROR.</li>
 *   <li>any other 4xx: {@link HubRequestRejectedException}, logged at WARN.</li>
 *   <li>2xx: the body is parsed into an {@link AuthorizationRecord}.</li>
 * </ul>
 * The cookie value is opaque: it is percent-encoded into the path and never logged.
 */
@Singleton
public class HubAuthorizationAccessor {

  private static final Logger log = LoggerFactory.getLogger(HubAuthorizationAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final HubConnectionInfo connectionInfo;

  /**
   * Instantiates a new Hub authorization accessor.
   *
   * @param httpClient     the http client
   * @param objectMapper   the object mapper
   * @param connectionInfo the hub connection info
   */
  @Inject
  public HubAuthorizationAccessor(final HttpClient httpClient,
                                  final ObjectMapper objectMapper,
                                  final HubConnectionInfo connectionInfo) {
    log.info("HubAuthorizationAccessor({})", connectionInfo);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.connectionInfo = connectionInfo;
  }

  /**
   * Asks the hub who the given session cookie belongs to.
   *
   * @param cookieName  the name of the hub session cookie
   * @param cookieValue the encrypted cookie value, passed through untouched
   * @return the authorization record, or empty if the hub does not recognize the cookie
   * @throws HubCredentialRejectedException if the hub rejects this server's API token
   * @throws HubUnavailableException        if the hub fails or cannot be reached
   * @throws HubRequestRejectedException    if the hub rejects the request as malformed
   */
  public Optional<AuthorizationRecord> fetchCookieAuthorization(final String cookieName,
                                                                final String cookieValue) {
    log.debug("fetchCookieAuthorization(cookieName={})", cookieName);
    HttpResponse<String> response = send(cookieAuthorizationUri(cookieName, cookieValue));
    int statusCode = response.statusCode();
    if (statusCode == 404) {
      log.debug("Hub does not recognize {} cookie", cookieName);
      return Optional.empty();
    }
    checkStatus(statusCode);
    return Optional.of(parse(response.body()));
  }

  /**
   * Builds the verification URI. Visible for tests.
   *
   * @param cookieName  the cookie name
   * @param cookieValue the cookie value
   * @return the uri
   */
  URI cookieAuthorizationUri(final String cookieName, final String cookieValue) {
    String base = connectionInfo.apiUrl().toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + "/authorizations/cookie/" + encodePathSegment(cookieName)
        + "/" + encodePathSegment(cookieValue));
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private HttpResponse<String> send(final URI uri) {
    HttpRequest request = HttpRequest.newBuilder()
        .uri(uri)
        .timeout(connectionInfo.requestTimeout())
        .header("Authorization", "token " + connectionInfo.apiKey())
        .header("Accept", "application/json")
        .GET()
        .build();
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      log.error("Upstream failure verifying auth token", e);
      throw new HubUnavailableException(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("Interrupted while verifying auth token");
      throw new HubUnavailableException(e);
    }
  }

  private void checkStatus(final int statusCode) {
    if (statusCode == 403) {
      log.error("I don't have permission to verify cookies, my auth token may have expired: [{}]",
          statusCode);
      throw new HubCredentialRejectedException();
    }
    if (statusCode >= 500) {
      log.error("Upstream failure verifying auth token: [{}]", statusCode);
      throw new HubUnavailableException(null);
    }
    if (statusCode >= 400) {
      log.warn("Failed to check authorization: [{}]", statusCode);
      throw new HubRequestRejectedException(statusCode);
    }
  }

  private AuthorizationRecord parse(final String body) {
    try {
      AuthorizationRecord record = objectMapper.readValue(body, AuthorizationRecord.class);
      if (record == null || record.name() == null) {
        throw new IllegalStateException("Hub authorization response has no name");
      }
      return record;
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unparseable hub authorization response", e);
    }
  }

  private static String encodePathSegment(final String value) {
    // URLEncoder is form encoding; a path segment wants %20, not '+'
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
