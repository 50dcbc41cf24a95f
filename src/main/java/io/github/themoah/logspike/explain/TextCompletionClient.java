package io.github.themoah.logspike.explain;

import io.vertx.core.Future;

/**
 * A text-completion service.
 */
public interface TextCompletionClient {

  /**
   * Sends a prompt and returns the completion text.
   */
  Future<String> complete(String prompt);

  /**
   * Releases any resources held by the client.
   */
  default void close() {
  }
}
