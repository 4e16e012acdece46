package com.gentoro.onerag.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

/** OkHttp clients for the REST-backed integrations. */
public final class OkHttpFactory {
  static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private OkHttpFactory() {}

  /**
   * Client with the given read/write timeout. A non-blank {@code apiKey} is sent as the {@code
   * api-key} header on every request.
   */
  public static OkHttpClient create(String apiKey, Duration timeout) {
    OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(CONNECT_TIMEOUT)
            .readTimeout(timeout)
            .writeTimeout(timeout);
    if (apiKey != null && !apiKey.isBlank()) {
      builder.addInterceptor(new ApiKeyInterceptor(apiKey));
    }
    return builder.addInterceptor(new LoggingInterceptor()).build();
  }
}
