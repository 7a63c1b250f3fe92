package com.gentoro.ragmcp.embedding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.ragmcp.exception.CancelledException;
import com.gentoro.ragmcp.exception.ConfigException;
import com.gentoro.ragmcp.exception.EmbeddingProviderException;
import com.gentoro.ragmcp.exception.SerializationException;
import com.gentoro.ragmcp.http.OkHttpFactory;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jetbrains.annotations.NotNull;

/**
 * Embedding client for providers exposing the OpenAI {@code POST /v1/embeddings} contract, such as
 * a LiteLLM proxy.
 *
 * <p>Calls are dispatched asynchronously and awaited, so interrupting the calling thread cancels
 * the HTTP exchange.
 */
public class OpenAiCompatibleEmbeddingClient implements EmbeddingClient {
  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(OpenAiCompatibleEmbeddingClient.class);

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final int MAX_ERROR_BODY = 300;

  private final EmbeddingSettings settings;
  private final OkHttpClient http;
  private final HttpUrl endpoint;
  private final ObjectMapper mapper = new ObjectMapper();

  public OpenAiCompatibleEmbeddingClient(EmbeddingSettings settings) {
    this(settings, OkHttpFactory.create(settings.timeoutSeconds()));
  }

  public OpenAiCompatibleEmbeddingClient(EmbeddingSettings settings, OkHttpClient http) {
    this.settings = settings;
    this.http = http;
    HttpUrl base = HttpUrl.parse(settings.baseUrl());
    if (base == null) {
      throw new ConfigException("Invalid embedding.base-url: " + settings.baseUrl());
    }
    this.endpoint = base.newBuilder().addPathSegments("v1/embeddings").build();
  }

  @Override
  public int dimensions() {
    return settings.dimensions();
  }

  @Override
  public double[] embed(String text) {
    Call call = http.newCall(buildRequest(text));
    CompletableFuture<Response> pending = new CompletableFuture<>();
    call.enqueue(
        new Callback() {
          @Override
          public void onFailure(@NotNull Call c, @NotNull IOException e) {
            pending.completeExceptionally(e);
          }

          @Override
          public void onResponse(@NotNull Call c, @NotNull Response response) {
            if (!pending.complete(response)) {
              response.close();
            }
          }
        });

    Response response;
    try {
      log.debug("Requesting embedding of {} character(s) from {}", text.length(), settings.model());
      response = pending.get();
    } catch (InterruptedException e) {
      pending.cancel(true);
      call.cancel();
      Thread.currentThread().interrupt();
      throw new CancelledException("Embedding request cancelled", e);
    } catch (ExecutionException e) {
      throw new EmbeddingProviderException(
          "Embedding request to " + endpoint + " failed: " + e.getCause().getMessage(),
          e.getCause());
    }

    try (response) {
      return parse(response);
    } catch (IOException e) {
      throw new EmbeddingProviderException("Failed to read embedding response", e);
    }
  }

  private Request buildRequest(String text) {
    ObjectNode payload = mapper.createObjectNode();
    payload.put("model", settings.model());
    payload.put("input", text);
    payload.put("temperature", settings.temperature());
    String body;
    try {
      body = mapper.writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Failed to serialize embedding request", e);
    }
    return new Request.Builder().url(endpoint).post(RequestBody.create(body, JSON)).build();
  }

  private double[] parse(Response response) throws IOException {
    ResponseBody body = response.body();
    String raw = body == null ? "" : body.string();
    if (!response.isSuccessful()) {
      throw new EmbeddingProviderException(
          "Embeddings provider error " + response.code() + ": " + truncate(raw));
    }

    JsonNode root;
    try {
      root = mapper.readTree(raw);
    } catch (JsonProcessingException e) {
      throw new EmbeddingProviderException("Embeddings provider returned invalid JSON", e);
    }
    JsonNode data = root == null ? null : root.get("data");
    if (data == null || !data.isArray() || data.isEmpty()) {
      throw new EmbeddingProviderException("Bad embeddings payload: " + truncate(raw));
    }
    JsonNode embedding = data.get(0).get("embedding");
    if (embedding == null || !embedding.isArray() || embedding.isEmpty()) {
      throw new EmbeddingProviderException(
          "Missing 'embedding' in item: " + truncate(data.get(0).toString()));
    }

    double[] vector = new double[embedding.size()];
    for (int i = 0; i < vector.length; i++) {
      JsonNode v = embedding.get(i);
      if (!v.isNumber()) {
        throw new EmbeddingProviderException("Non-numeric value at embedding[" + i + "]");
      }
      vector[i] = v.asDouble();
    }
    if (settings.dimensions() > 0 && vector.length != settings.dimensions()) {
      throw new EmbeddingProviderException(
          "Expected embedding of "
              + settings.dimensions()
              + " dimensions from model "
              + settings.model()
              + " but got "
              + vector.length);
    }
    return vector;
  }

  private static String truncate(String s) {
    return s.length() > MAX_ERROR_BODY ? s.substring(0, MAX_ERROR_BODY) + "..." : s;
  }
}
