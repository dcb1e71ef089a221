package com.codeheadsystems.hubauth.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire model for the hub's answer to a successful cookie verification.
 * <p>
 * The hub responds with its user model; only {@code name} is required to establish identity.
 * The remaining fields are carried through for hosts that want them, and any field the hub
 * adds later is ignored.
 * <p>
 * Used by: {@code GET {hubApiUrl}/authorizations/cookie/{cookieName}/{cookieValue}} response
 *
 * @param name   the identity name the cookie belongs to
 * @param admin  whether the hub considers this user an administrator
 * @param groups hub groups the user belongs to, empty when the hub does not report any
 * @param server the URL prefix of the user's single-user server, if the hub reports one
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthorizationRecord(
    @JsonProperty("name") String name,
    @JsonProperty("admin") boolean admin,
    @JsonProperty("groups") List<String> groups,
    @JsonProperty("server") String server) {

  /**
   * Compact constructor, normalizes a missing group list.
   */
  public AuthorizationRecord {
    groups = groups == null ? List.of() : List.copyOf(groups);
  }

  /**
   * Creates a record carrying only the identity name.
   *
   * @param name the identity name
   * @return the authorization record
   */
  public static AuthorizationRecord forName(String name) {
    return new AuthorizationRecord(name, false, List.of(), null);
  }
}
