package com.gentoro.onerag.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Adds the {@code api-key} header expected by Qdrant. */
public class ApiKeyInterceptor implements Interceptor {
  private final String apiKey;

  public ApiKeyInterceptor(String apiKey) {
    this.apiKey = apiKey;
  }

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request().newBuilder().header("api-key", apiKey).build();
    return chain.proceed(request);
  }
}
