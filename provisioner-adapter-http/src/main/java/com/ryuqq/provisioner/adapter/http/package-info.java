/**
 * JSON over HTTP adapters built on the JDK {@link java.net.http.HttpClient} and Jackson.
 *
 * <p>Adapters perform one request per call and report outcomes as
 * {@link com.ryuqq.provisioner.core.result.CallResult}; circuit breaking happens in the application layer.</p>
 */
package com.ryuqq.provisioner.adapter.http;
