/*
 * Copyright The Quickwit Ingest Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package quickwit.ingest.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import quickwit.ingest.RecordEncoder;

/**
 * Encodes arbitrary records, such as maps, POJOs or {@code JsonNode}s, with Jackson. No schema is
 * imposed, so records of different types can be ingested into the same client.
 *
 * <p>The default mapper sorts map entries by key, so that re-encoding a retained batch produces
 * the same bytes even for maps without a stable iteration order.
 */
public final class JacksonRecordEncoder implements RecordEncoder<Object> {
  /** Creates an encoder with a default {@link ObjectMapper}. */
  public static JacksonRecordEncoder create() {
    return new JacksonRecordEncoder(new ObjectMapper()
      .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true));
  }

  /**
   * Creates an encoder using the given mapper, for example one with modules registered. The mapper
   * must not be configured to indent output, as records are delimited by newlines.
   */
  public static JacksonRecordEncoder create(ObjectMapper mapper) {
    if (mapper == null) throw new NullPointerException("mapper == null");
    if (mapper.isEnabled(SerializationFeature.INDENT_OUTPUT)) {
      throw new IllegalArgumentException("mapper must not indent output");
    }
    return new JacksonRecordEncoder(mapper);
  }

  final ObjectMapper mapper;

  JacksonRecordEncoder(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override public byte[] encode(Object record) {
    try {
      return mapper.writeValueAsBytes(record);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException(
        "cannot encode " + record.getClass().getName() + ": " + e.getOriginalMessage(), e);
    }
  }

  @Override public String toString() {
    return "JacksonRecordEncoder";
  }
}
