/**
 * JSON-over-HTTP adapters for the validation, copy and metadata job services,
 * built on {@code java.net.http.HttpClient} and Jackson.
 */
package com.ryuqq.handover.adapter.http;
