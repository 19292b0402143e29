/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.statsketch.sinks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.projectasap.statsketch.datamodel.SerializableToSink;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.apache.flink.api.common.serialization.Encoder;
import org.apache.flink.api.connector.sink2.Sink;
import org.apache.flink.connector.file.sink.FileSink;
import org.apache.flink.core.fs.Path;
import org.apache.flink.streaming.api.functions.sink.filesystem.rollingpolicies.DefaultRollingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builder for row-format file sinks writing window outputs or running statistics. */
public class SinkBuilder {
  private static final Logger logger = LoggerFactory.getLogger(SinkBuilder.class);

  /**
   * Builds a file sink.
   *
   * @param outputFormat "byte" for raw bytes or "json" for one JSON document per line
   * @param outputPath directory the sink writes part files into
   * @return the configured Flink sink
   */
  public static <T extends SerializableToSink> Sink<T> buildSink(
      String outputFormat, String outputPath) {
    if (!"byte".equals(outputFormat) && !"json".equals(outputFormat)) {
      throw new IllegalArgumentException("Invalid output format: " + outputFormat);
    }

    logger.info("Building sink with output format: {}", outputFormat);
    logger.info("Using file sink with path: {}", outputPath);

    return FileSink.forRowFormat(new Path(outputPath), new RecordEncoder<T>(outputFormat))
        .withRollingPolicy(
            DefaultRollingPolicy.builder()
                .withRolloverInterval(Duration.ofMinutes(15))
                .withInactivityInterval(Duration.ofMinutes(1))
                .withMaxPartSize(1024 * 1024 * 1024)
                .build())
        .build();
  }

  /** Encodes one record per row, as raw bytes or as a JSON line. */
  static class RecordEncoder<T extends SerializableToSink> implements Encoder<T> {
    private final String outputFormat;

    RecordEncoder(String outputFormat) {
      this.outputFormat = outputFormat;
    }

    @Override
    public void encode(T data, OutputStream stream) throws IOException {
      if (outputFormat.equals("byte")) {
        stream.write(data.serializeToBytes());
        return;
      }
      try {
        ObjectMapper objectMapper = new ObjectMapper();
        stream.write(objectMapper.writeValueAsBytes(data.serializeToJson()));
        stream.write("\n".getBytes(StandardCharsets.UTF_8));
      } catch (JsonProcessingException e) {
        logger.info("Error serializing to JSON", e);
        throw new IOException("Error serializing to JSON", e);
      }
    }
  }
}
