package com.gentoro.scheduler.http;

import com.gentoro.scheduler.logging.LoggingService;
import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

/** Logs outgoing requests with their status and duration. Bodies are not logged. */
public class LoggingInterceptor implements Interceptor {
  private static final Logger log = LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    long startTime = System.nanoTime();
    log.debug("Sending request {} {}", request.method(), request.url());

    Response response;
    try {
      response = chain.proceed(request);
    } catch (IOException e) {
      long durationMs = (System.nanoTime() - startTime) / 1_000_000;
      String message = e.getMessage();
      if (message == null || message.isEmpty()) {
        message = e.getClass().getSimpleName();
      }
      log.warn(
          "Request failed: {} {} ({}ms): {}", request.method(), request.url(), durationMs, message);
      throw e;
    }

    long durationMs = (System.nanoTime() - startTime) / 1_000_000;
    log.debug(
        "Received response for {} in {}ms, status {}",
        response.request().url(),
        durationMs,
        response.code());
    return response;
  }
}
