package com.gentoro.ragmcp.http;

import java.io.IOException;
import okhttp3.*;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/** Logs outbound requests at DEBUG and response bodies at TRACE. Authorization is masked. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(LoggingInterceptor.class);

  private static final int MAX_LOGGED_BODY = 2000;

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    if (!log.isDebugEnabled()) {
      return chain.proceed(request);
    }

    long startTime = System.nanoTime();
    log.debug(
        "Sending {} {}\nHeaders:\n{}\nBody:\n{}",
        request.method(),
        request.url(),
        maskedHeaders(request.headers()),
        bodyToString(request));

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "Received response for {} in {} ms, status {}",
        response.request().url(),
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.code());

    if (log.isTraceEnabled()) {
      ResponseBody responseBody = response.peekBody(MAX_LOGGED_BODY);
      log.trace("Response body (truncated):\n{}", responseBody.string());
    }
    return response;
  }

  private static String maskedHeaders(Headers headers) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < headers.size(); i++) {
      String name = headers.name(i);
      String value = "authorization".equalsIgnoreCase(name) ? "***" : headers.value(i);
      sb.append(name).append(": ").append(value).append('\n');
    }
    return sb.toString();
  }

  private static String bodyToString(Request request) {
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      String body = buffer.readUtf8();
      return body.length() > MAX_LOGGED_BODY ? body.substring(0, MAX_LOGGED_BODY) + "..." : body;
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
