/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonRecordEncoderTest {
  JacksonRecordEncoder encoder = JacksonRecordEncoder.create();

  public static final class LogLine {
    public final String service;
    public final int status;

    LogLine(String service, int status) {
      this.service = service;
      this.status = status;
    }
  }

  @Test void encodesMap() {
    assertThat(encode(Map.of("s", "a"))).isEqualTo("{\"s\":\"a\"}");
  }

  @Test void encodesMapsInKeyOrder() {
    Map<String, Object> record = new HashMap<>();
    record.put("t", "2024-01-01T00:00:00Z");
    record.put("s", "test");
    record.put("i", 0);

    assertThat(encode(record))
      .isEqualTo("{\"i\":0,\"s\":\"test\",\"t\":\"2024-01-01T00:00:00Z\"}");
  }

  @Test void encodesPojo() {
    assertThat(encode(new LogLine("frontend", 200)))
      .isEqualTo("{\"service\":\"frontend\",\"status\":200}");
  }

  @Test void encodesScalarsAndLists() {
    assertThat(encode("a")).isEqualTo("\"a\"");
    assertThat(encode(List.of(1, 2))).isEqualTo("[1,2]");
  }

  @Test void escapesNewlines() {
    assertThat(encode(Map.of("msg", "line1\nline2"))).doesNotContain("\n");
  }

  @Test void unencodableRecord() {
    assertThatThrownBy(() -> encoder.encode(new Object()))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageStartingWith("cannot encode java.lang.Object");
  }

  @Test void rejectsIndentingMapper() {
    ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    assertThatThrownBy(() -> JacksonRecordEncoder.create(mapper))
      .isInstanceOf(IllegalArgumentException.class);
  }

  String encode(Object record) {
    return new String(encoder.encode(record), UTF_8);
  }
}
