package io.filesurf.retrywork;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

class RetrySettingsLoaderTest {

  private final RetrySettingsLoader loader = new RetrySettingsLoader();

  @Test
  void testFromJson_AttemptPolicy() {
    RetrySettings settings =
        loader.fromJson(
            "{\"maxAttempts\": 4, \"delay\": \"PT0.25S\","
                + " \"retryOn\": [\"java.lang.IllegalStateException\"]}");

    assertEquals(4, settings.maxAttempts());
    assertEquals(Duration.ofMillis(250), settings.delay());
    assertEquals(new StoppingPolicy.MaxAttempts(4), settings.stoppingPolicy());

    RetryConfig config = settings.toConfigBuilder().build();
    assertTrue(config.classifier().isRetryable(new IllegalStateException()));
    assertFalse(config.classifier().isRetryable(new IllegalArgumentException()));
    assertEquals(Duration.ofMillis(250), config.delay());
  }

  @Test
  void testFromJson_DeadlinePolicyWithNumericSeconds() {
    RetrySettings settings = loader.fromJson("{\"timeout\": 2}");

    assertEquals(new StoppingPolicy.Deadline(Duration.ofSeconds(2)), settings.stoppingPolicy());
    assertNull(settings.delay());
  }

  @Test
  void testFromJson_EmptyDocument_Defaults() {
    RetrySettings settings = loader.fromJson("{}");
    RetryConfig config = settings.toConfigBuilder().build();

    assertEquals(StoppingPolicy.defaults(), config.stoppingPolicy());
    assertSame(FailureClassifier.any(), config.classifier());
    assertEquals(List.of(), settings.retryOn());
  }

  @Test
  void testFromJson_AttemptsAndTimeoutAreExclusive() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> loader.fromJson("{\"maxAttempts\": 3, \"timeout\": \"PT1S\"}"));

    assertTrue(e.getMessage().contains("mutually exclusive"), e.getMessage());
  }

  @Test
  void testFromJson_InvalidValuesRejected() {
    assertThrows(IllegalArgumentException.class, () -> loader.fromJson("{\"maxAttempts\": 0}"));
    assertThrows(IllegalArgumentException.class, () -> loader.fromJson("{\"timeout\": \"-PT1S\"}"));
    assertThrows(IllegalArgumentException.class, () -> loader.fromJson("{\"delay\": \"-PT1S\"}"));
    assertThrows(IllegalArgumentException.class, () -> loader.fromJson("{\"maxAttempts\": "));
    assertThrows(IllegalArgumentException.class, () -> loader.fromJson("null"));
  }

  @Test
  void testFromJson_UnknownPropertyRejected() {
    assertThrows(IllegalArgumentException.class, () -> loader.fromJson("{\"jitter\": 10}"));
  }

  @Test
  void testFromJson_UnknownOrNonExceptionTypeRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> loader.fromJson("{\"retryOn\": [\"com.example.NoSuchException\"]}"));
    assertThrows(
        IllegalArgumentException.class,
        () -> loader.fromJson("{\"retryOn\": [\"java.lang.String\"]}"));
  }

  @Test
  void testFromResource() {
    RetrySettings settings = loader.fromResource("retry-settings.json");

    assertEquals(Duration.ofMillis(700), settings.timeout());
    assertEquals(Duration.ofMillis(50), settings.delay());
    assertEquals(
        List.of("java.io.IOException", "java.util.concurrent.TimeoutException"),
        settings.retryOn());
    assertEquals(
        "IOException | TimeoutException",
        settings.toConfigBuilder().build().classifier().category());
  }

  @Test
  void testFromResource_WithoutContextClassLoader_UsesLibraryLoader() {
    Thread thread = Thread.currentThread();
    ClassLoader original = thread.getContextClassLoader();
    thread.setContextClassLoader(null);
    try {
      RetrySettings settings = loader.fromResource("retry-settings.json");

      assertEquals(Duration.ofMillis(700), settings.timeout());
      assertEquals(
          "IOException | TimeoutException",
          settings.toConfigBuilder().build().classifier().category());
    } finally {
      thread.setContextClassLoader(original);
    }
  }

  @Test
  void testFromJson_DelayBeyondMaximum_Rejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> loader.fromJson("{\"delay\": " + Long.MAX_VALUE + "}"));
  }

  @Test
  void testFromResource_Missing() {
    assertThrows(IllegalArgumentException.class, () -> loader.fromResource("missing.json"));
  }

  @Test
  void testFromFile(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("retry.json");
    Files.writeString(file, "{\"maxAttempts\": 6}");

    assertEquals(6, loader.fromFile(file).maxAttempts());
    assertThrows(IllegalArgumentException.class, () -> loader.fromFile(dir.resolve("nope.json")));
  }
}
