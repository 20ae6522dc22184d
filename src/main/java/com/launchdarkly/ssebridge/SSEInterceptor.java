package com.launchdarkly.ssebridge;

import okhttp3.Interceptor;

/**
 * A stage in the request pipeline of an {@link SSEClient}.
 * <p>
 * This is an OkHttp application {@link Interceptor}. Stages added with
 * {@link SSEClient#addInterceptor(SSEInterceptor)} run after the built-in
 * {@link LoggingInterceptor} and {@link HeaderInterceptor}, in the order they were added, and
 * can rewrite the outgoing request (for instance to add an {@code Authorization} header) or
 * inspect the response.
 * <p>
 * Every stage must call {@link Interceptor.Chain#proceed(okhttp3.Request)} exactly once.
 * Returning a synthesized response without proceeding is not supported, since the client
 * expects a live event stream as the response body.
 * <pre><code>
 *   client.addInterceptor(chain -&gt; chain.proceed(
 *       chain.request().newBuilder().header("Authorization", token).build()));
 * </code></pre>
 */
public interface SSEInterceptor extends Interceptor {
}
