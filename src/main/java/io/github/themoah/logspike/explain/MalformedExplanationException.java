package io.github.themoah.logspike.explain;

/**
 * Thrown when a completion does not follow the expected explanation format.
 */
public class MalformedExplanationException extends RuntimeException {

  private final String response;

  public MalformedExplanationException(String message, String response) {
    super(message);
    this.response = response;
  }

  public MalformedExplanationException(String message, String response, Throwable cause) {
    super(message, cause);
    this.response = response;
  }

  /**
   * Returns the raw completion text that failed to parse.
   */
  public String response() {
    return response;
  }
}
