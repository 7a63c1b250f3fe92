package com.gentoro.ragmcp.http;

import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  public static OkHttpClient create(int timeoutSeconds) {
    return builder(timeoutSeconds).build();
  }

  public static OkHttpClient.Builder builder(int timeoutSeconds) {
    return new OkHttpClient.Builder()
        .connectTimeout(10, TimeUnit.SECONDS)
        .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
        .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
        .addInterceptor(new LoggingInterceptor());
  }
}
