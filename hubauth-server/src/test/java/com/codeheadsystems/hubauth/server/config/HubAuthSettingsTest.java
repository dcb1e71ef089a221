package com.codeheadsystems.hubauth.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.hubauth.server.auth.HubLogoutAction;
import java.net.URI;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class HubAuthSettingsTest {

  private static HubAuthSettings settings(String hubHost, String hubPrefix, long lifetime) {
    return new HubAuthSettings("alice", "jupyter-hub-token", URI.create("http://127.0.0.1:8081/hub/api"),
        "api-key", hubPrefix, hubHost, lifetime, Duration.ofSeconds(30));
  }

  @ParameterizedTest
  @CsvSource({
      "'', /hub/, /hub/logout",
      "'', /hub, /hub/logout",
      "'', hub/, /hub/logout",
      "https://hub.example.org, /hub/, https://hub.example.org/hub/logout",
      "https://hub.example.org/, /hub/, https://hub.example.org/hub/logout"
  })
  void logoutLocation_joinsHostAndPrefix(String host, String prefix, String expected) {
    assertThat(settings(host, prefix, 300).logoutLocation()).isEqualTo(URI.create(expected));
  }

  @Test
  void loginLocation_usesHubLoginPage() {
    assertThat(settings("https://hub.example.org", "/hub/", 300).loginLocation())
        .isEqualTo(URI.create("https://hub.example.org/hub/login"));
  }

  @Test
  void hubLogoutAction_redirectsToHubLogout() {
    assertThat(new HubLogoutAction(settings("", "/hub/", 300)).logoutLocation())
        .isEqualTo(URI.create("/hub/logout"));
  }

  @Test
  void nullHost_isTreatedAsSameOrigin() {
    assertThat(settings(null, "/hub/", 300).hubHost()).isEmpty();
  }

  @Test
  void negativeLifetime_isRejected() {
    assertThatThrownBy(() -> settings("", "/hub/", -1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("cookieCacheLifetimeSeconds");
  }

  @Test
  void missingUser_isRejected() {
    assertThatThrownBy(() -> new HubAuthSettings(" ", "c", URI.create("http://hub"), "k", "/hub/", "",
        0, Duration.ofSeconds(1)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("expectedIdentity");
  }

  @Test
  void toString_hidesApiKey() {
    assertThat(settings("", "/hub/", 300).toString()).doesNotContain("api-key");
  }

  @Test
  void hubConnectionInfo_carriesApiSettings() {
    HubAuthSettings settings = settings("", "/hub/", 300);

    assertThat(settings.hubConnectionInfo().apiUrl()).isEqualTo(settings.hubApiUrl());
    assertThat(settings.hubConnectionInfo().apiKey()).isEqualTo("api-key");
    assertThat(settings.hubConnectionInfo().requestTimeout()).isEqualTo(Duration.ofSeconds(30));
  }
}
