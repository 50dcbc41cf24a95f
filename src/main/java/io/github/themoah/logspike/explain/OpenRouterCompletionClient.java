package io.github.themoah.logspike.explain;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Completion client for the OpenRouter chat completions API.
 */
public class OpenRouterCompletionClient implements TextCompletionClient {

  private static final Logger log = LoggerFactory.getLogger(OpenRouterCompletionClient.class);

  private final WebClient client;
  private final ExplainerConfig config;

  public OpenRouterCompletionClient(Vertx vertx, ExplainerConfig config) {
    if (!config.isEnabled()) {
      throw new IllegalStateException("OPENROUTER_API_KEY not set");
    }
    this.config = config;
    this.client = WebClient.create(vertx, new WebClientOptions()
      .setUserAgent("logspike")
      .setConnectTimeout((int) config.timeout().toMillis()));
  }

  @Override
  public Future<String> complete(String prompt) {
    JsonObject payload = buildPayload(prompt);
    log.debug("Requesting completion from {} with model {}", config.endpoint(), config.model());

    return client.postAbs(config.endpoint())
      .bearerTokenAuthentication(config.apiKey())
      .putHeader("Content-Type", "application/json")
      .putHeader("X-Title", "logspike")
      .timeout(config.timeout().toMillis())
      .sendJsonObject(payload)
      .compose(this::extractContent)
      .onFailure(err -> log.warn("Completion request failed: {}", err.getMessage()));
  }

  JsonObject buildPayload(String prompt) {
    return new JsonObject()
      .put("model", config.model())
      .put("messages", new JsonArray()
        .add(new JsonObject().put("role", "user").put("content", prompt)))
      .put("temperature", config.temperature())
      .put("max_tokens", config.maxTokens());
  }

  private Future<String> extractContent(HttpResponse<Buffer> response) {
    if (response.statusCode() != 200) {
      return Future.failedFuture(new IllegalStateException(
        "OpenRouter returned HTTP " + response.statusCode() + ": " + response.bodyAsString()));
    }
    try {
      return Future.succeededFuture(contentOf(response.bodyAsJsonObject()));
    } catch (RuntimeException e) {
      return Future.failedFuture(e);
    }
  }

  /**
   * Extracts {@code choices[0].message.content} from a chat completion body.
   *
   * @throws IllegalStateException if the body does not have that shape
   */
  static String contentOf(JsonObject body) {
    JsonArray choices = body == null ? null : body.getJsonArray("choices");
    if (choices == null || choices.isEmpty()) {
      throw new IllegalStateException("Unexpected OpenRouter response: " + body);
    }
    JsonObject message = choices.getJsonObject(0).getJsonObject("message");
    String content = message == null ? null : message.getString("content");
    if (content == null) {
      throw new IllegalStateException("Unexpected OpenRouter response: " + body);
    }
    return content;
  }

  @Override
  public void close() {
    client.close();
  }
}
