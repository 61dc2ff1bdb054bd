package io.filesurf.retrywork;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Reads {@link RetrySettings} from JSON. Durations are ISO-8601 strings ({@code "PT0.5S"}) or
 * numbers of seconds.
 */
public class RetrySettingsLoader {

  private static final Logger LOG = LoggerFactory.getLogger(RetrySettingsLoader.class);

  private final ObjectMapper objectMapper =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  /**
   * Parses settings from a JSON string.
   *
   * @throws IllegalArgumentException if the document is malformed or the settings are invalid
   */
  public RetrySettings fromJson(String json) {
    try {
      return validate(objectMapper.readValue(json, RetrySettings.class));
    } catch (JsonProcessingException e) {
      throw invalid(e);
    }
  }

  /** Parses settings from a JSON stream. The stream is not closed. */
  public RetrySettings fromStream(InputStream in) {
    try {
      return validate(objectMapper.readValue(in, RetrySettings.class));
    } catch (JsonProcessingException e) {
      throw invalid(e);
    } catch (IOException e) {
      throw new IllegalArgumentException("Error reading retry settings: " + e.getMessage(), e);
    }
  }

  public RetrySettings fromFile(Path path) {
    LOG.debug("Loading retry settings from {}", path);
    try (InputStream in = Files.newInputStream(path)) {
      return fromStream(in);
    } catch (IOException e) {
      throw new IllegalArgumentException(
          "Error reading retry settings from " + path + ": " + e.getMessage(), e);
    }
  }

  /**
   * Loads settings from a classpath resource of the context class loader, or of this library's
   * class loader when the thread has none.
   */
  public RetrySettings fromResource(String resource) {
    LOG.debug("Loading retry settings from classpath resource {}", resource);
    ClassLoader classLoader = RetrySettings.defaultClassLoader();
    try (InputStream in = classLoader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("Retry settings resource not found: " + resource);
      }
      return fromStream(in);
    } catch (IOException e) {
      throw new IllegalArgumentException(
          "Error reading retry settings resource " + resource + ": " + e.getMessage(), e);
    }
  }

  private RetrySettings validate(RetrySettings settings) {
    if (settings == null) {
      throw new IllegalArgumentException("Retry settings document is empty");
    }
    // Resolves retryOn types and checks policy values eagerly.
    settings.toConfigBuilder().build();
    return settings;
  }

  private static IllegalArgumentException invalid(JsonProcessingException e) {
    // Constructor failures arrive wrapped; report the record's own message.
    Throwable cause =
        e instanceof ValueInstantiationException && e.getCause() != null ? e.getCause() : e;
    return new IllegalArgumentException("Invalid retry settings: " + cause.getMessage(), e);
  }
}
