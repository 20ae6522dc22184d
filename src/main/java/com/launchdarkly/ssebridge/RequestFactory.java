package com.launchdarkly.ssebridge;

import okhttp3.MediaType;
import okhttp3.Request;
import okhttp3.RequestBody;

/**
 * Converts an {@link SSERequest} into an OkHttp request. The SSE-specific headers are added
 * later by {@link HeaderInterceptor}.
 */
abstract class RequestFactory {
  static final MediaType JSON_CONTENT_TYPE = MediaType.get("application/json; charset=utf-8");

  private RequestFactory() {}

  static Request create(SSERequest sseRequest) {
    Request.Builder builder = new Request.Builder()
        .url(sseRequest.getUrl())
        .headers(sseRequest.getHeaders());
    switch (sseRequest.getMethod()) {
    case POST:
      // The content type is fixed regardless of whether the body really is JSON.
      builder.post(RequestBody.create(sseRequest.getBody().getBytes(Helpers.UTF8), JSON_CONTENT_TYPE));
      break;
    case GET:
    default:
      builder.get();
      break;
    }
    return builder.build();
  }
}
