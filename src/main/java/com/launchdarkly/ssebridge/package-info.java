/**
 * A callback-based client for the
 * <a href="https://html.spec.whatwg.org/multipage/server-sent-events.html#server-sent-events">Server-Sent
 * Events</a> (SSE) protocol, built on OkHttp.
 * <p>
 * The simplest entry point is {@link com.launchdarkly.ssebridge.SSEBridge}; applications that need
 * finer control can use {@link com.launchdarkly.ssebridge.SSEClient} directly.
 */
package com.launchdarkly.ssebridge;
