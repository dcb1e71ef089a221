package com.codeheadsystems.hubauth.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AuthorizationRecordTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void deserialize_nameOnly_defaultsOptionalFields() throws Exception {
    AuthorizationRecord record = objectMapper.readValue("{\"name\":\"alice\"}", AuthorizationRecord.class);

    assertThat(record.name()).isEqualTo("alice");
    assertThat(record.admin()).isFalse();
    assertThat(record.groups()).isEmpty();
    assertThat(record.server()).isNull();
  }

  @Test
  void deserialize_fullHubUserModel_ignoresUnknownFields() throws Exception {
    String body = "{\"kind\":\"user\",\"name\":\"bob\",\"admin\":true,"
        + "\"groups\":[\"staff\",\"physics\"],\"server\":\"/user/bob/\","
        + "\"pending\":null,\"last_activity\":\"2024-01-01T00:00:00Z\"}";

    AuthorizationRecord record = objectMapper.readValue(body, AuthorizationRecord.class);

    assertThat(record.name()).isEqualTo("bob");
    assertThat(record.admin()).isTrue();
    assertThat(record.groups()).containsExactly("staff", "physics");
    assertThat(record.server()).isEqualTo("/user/bob/");
  }

  @Test
  void groups_areImmutableCopy() {
    List<String> groups = new ArrayList<>(List.of("a"));
    AuthorizationRecord record = new AuthorizationRecord("carol", false, groups, null);
    groups.add("b");

    assertThat(record.groups()).containsExactly("a");
    assertThat(AuthorizationRecord.forName("carol").groups()).isEmpty();
  }
}
