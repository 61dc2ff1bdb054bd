package io.filesurf.retrywork;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {

  @Test
  void testAny_AcceptsEveryException() {
    FailureClassifier classifier = FailureClassifier.any();

    assertTrue(classifier.isRetryable(new IllegalStateException()));
    assertTrue(classifier.isRetryable(new IOException()));
    assertEquals("Exception", classifier.category());
  }

  @Test
  void testOfType_MatchesSubtypes() {
    FailureClassifier classifier = FailureClassifier.ofType(IOException.class);

    assertTrue(classifier.isRetryable(new IOException()));
    assertTrue(classifier.isRetryable(new FileNotFoundException()));
    assertFalse(classifier.isRetryable(new IllegalStateException()));
    assertEquals("IOException", classifier.category());
  }

  @Test
  void testAnyOf_MatchesEachListedType() {
    FailureClassifier classifier =
        FailureClassifier.anyOf(IOException.class, TimeoutException.class);

    assertTrue(classifier.isRetryable(new TimeoutException()));
    assertTrue(classifier.isRetryable(new FileNotFoundException()));
    assertFalse(classifier.isRetryable(new IllegalArgumentException()));
    assertEquals("IOException | TimeoutException", classifier.category());
  }

  @Test
  void testAnyOf_NoTypes_Rejected() {
    assertThrows(IllegalArgumentException.class, FailureClassifier::anyOf);
  }

  @Test
  void testMatching_DelegatesToPredicate() {
    FailureClassifier classifier =
        FailureClassifier.matching(
            "Throttled", e -> e.getMessage() != null && e.getMessage().contains("429"));

    assertTrue(classifier.isRetryable(new IOException("HTTP 429")));
    assertFalse(classifier.isRetryable(new IOException("HTTP 404")));
    assertEquals("Throttled", classifier.category());
  }
}
