package com.codeheadsystems.weft.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SessionCodecTest {

  private static final Instant CREATED = Instant.parse("2026-01-01T00:00:00Z");

  @Test
  void toSession_restoresPayloadAndMetadata() {
    SessionRecord record = new SessionRecord("key", "{\"value\":2,\"name\":\"bob\",\"tags\":[\"a\"]}",
        CREATED, CREATED, "1.1.1.1", "hi");

    Session session = SessionCodec.toSession(record);

    assertThat(session.sessionKey()).isEqualTo("key");
    assertThat(session.createdAt()).isEqualTo(CREATED);
    assertThat(session.get("value", Integer.class)).contains(2);
    assertThat(session.get("name", String.class)).contains("bob");
    assertThat(session.get("tags")).isEqualTo(List.of("a"));
    assertThat(session.isModified()).isFalse();
  }

  @Test
  void toSession_corruptPayload_yieldsEmptySession() {
    SessionRecord record = new SessionRecord("key", "{not json", CREATED, CREATED, "", "");

    assertThat(SessionCodec.toSession(record).keys()).isEmpty();
  }

  @Test
  void encode_writesCurrentPayload() {
    Session session = new Session("key", CREATED, Map.of());
    session.put("value", 0);

    assertThat(SessionCodec.encode(session)).isEqualTo("{\"value\":0}");
    assertThat(session.isModified()).isTrue();
  }

  @Test
  void encode_unserializableValue_throws() {
    Session session = new Session("key", CREATED, Map.of());
    session.put("thread", new Object());

    assertThatThrownBy(() -> SessionCodec.encode(session)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void isExpired_boundaryIsInclusive() {
    SessionRecord record = new SessionRecord("key", "{}", CREATED, CREATED, "", "");

    assertThat(record.isExpired(CREATED.plusSeconds(59), 60)).isFalse();
    assertThat(record.isExpired(CREATED.plusSeconds(60), 60)).isTrue();
  }

  @Test
  void isExpired_hugeMaxAge_neverExpires() {
    SessionRecord record = new SessionRecord("k", SessionCodec.EMPTY, CREATED, CREATED, "", "");

    assertThat(record.isExpired(CREATED.plus(Duration.ofDays(365 * 100)), Long.MAX_VALUE)).isFalse();
  }
}
