package com.lphedge.http;

import java.net.URI;
import java.util.Objects;

/**
 * Non-2xx answer from an upstream venue (exchange REST API, chat API).
 */
public final class VenueHttpException extends RuntimeException {

  private static final int SNIPPET_LIMIT = 2000;

  private final String method;
  private final URI uri;
  private final int statusCode;
  private final String responseSnippet;

  public VenueHttpException(String method, URI uri, int statusCode, String responseBody) {
    super("HTTP " + statusCode + " from " + method + " " + redact(uri) + ": " + truncate(responseBody));
    this.method = Objects.requireNonNull(method, "method");
    this.uri = Objects.requireNonNull(uri, "uri");
    this.statusCode = statusCode;
    this.responseSnippet = truncate(responseBody);
  }

  public String method() {
    return method;
  }

  public URI uri() {
    return uri;
  }

  /**
   * Request URI without its query string. Signed Binance GETs carry the signature there and chat
   * URIs carry the bot token in the path, so only scheme and host are kept for those.
   */
  public String redactedUri() {
    return redact(uri);
  }

  public int statusCode() {
    return statusCode;
  }

  public String responseSnippet() {
    return responseSnippet;
  }

  static String redact(URI uri) {
    if (uri == null) {
      return "";
    }
    String path = uri.getRawPath() == null ? "" : uri.getRawPath();
    if (path.startsWith("/bot")) {
      path = "/bot***" + path.substring(path.indexOf('/', 1) < 0 ? path.length() : path.indexOf('/', 1));
    }
    return uri.getScheme() + "://" + uri.getRawAuthority() + path;
  }

  private static String truncate(String s) {
    if (s == null) {
      return "";
    }
    return s.length() <= SNIPPET_LIMIT ? s : s.substring(0, SNIPPET_LIMIT) + "...";
  }
}
