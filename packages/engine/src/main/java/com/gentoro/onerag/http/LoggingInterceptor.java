package com.gentoro.onerag.http;

import java.io.IOException;
import java.util.concurrent.TimeUnit;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/**
 * Logs each HTTP exchange at DEBUG, with response bodies at TRACE. Headers are not logged, so API
 * keys stay out of the log.
 */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(LoggingInterceptor.class);

  static final int BODY_PREVIEW_CHARS = 2048;

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    if (!log.isDebugEnabled()) {
      return chain.proceed(request);
    }
    log.debug("HTTP {} {} body={}", request.method(), request.url(), preview(request.body()));
    long started = System.nanoTime();
    Response response = chain.proceed(request);
    log.debug(
        "HTTP {} {} -> {} ({} ms)",
        request.method(),
        request.url(),
        response.code(),
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
    if (log.isTraceEnabled()) {
      log.trace("HTTP response body: {}", response.peekBody(BODY_PREVIEW_CHARS).string());
    }
    return response;
  }

  static String preview(RequestBody body) throws IOException {
    if (body == null) {
      return "<empty>";
    }
    Buffer buffer = new Buffer();
    body.writeTo(buffer);
    String text = buffer.readUtf8();
    return text.length() <= BODY_PREVIEW_CHARS
        ? text
        : text.substring(0, BODY_PREVIEW_CHARS) + "... (" + text.length() + " chars)";
  }
}
