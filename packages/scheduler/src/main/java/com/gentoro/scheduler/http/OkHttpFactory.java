package com.gentoro.scheduler.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  /**
   * Client for calls to the task invocation endpoint. The read timeout bounds the time a remote
   * task may take to execute.
   */
  public static OkHttpClient create(Duration readTimeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(Duration.ofSeconds(10))
        .readTimeout(readTimeout)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
