package com.lphedge.http;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

public final class HttpRequestFactory {

  private final URI baseUri;

  public HttpRequestFactory(URI baseUri) {
    this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
  }

  public HttpRequest.Builder request(String path, Map<String, String> query) {
    return HttpRequest.newBuilder(buildUri(path, encodeQuery(query)));
  }

  /**
   * Request whose query string is already encoded, e.g. a signed Binance query that must reach the
   * server byte for byte as it was signed.
   */
  public HttpRequest.Builder requestWithRawQuery(String path, String rawQuery) {
    return HttpRequest.newBuilder(buildUri(path, rawQuery));
  }

  public static String encodeQuery(Map<String, String> query) {
    if (query == null || query.isEmpty()) {
      return "";
    }
    return query.entrySet().stream()
        .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
        .collect(Collectors.joining("&"));
  }

  private URI buildUri(String path, String rawQuery) {
    StringBuilder sb = new StringBuilder(baseUri.toString());
    if (sb.charAt(sb.length() - 1) == '/' && path.startsWith("/")) {
      sb.setLength(sb.length() - 1);
    }
    sb.append(path);
    if (rawQuery != null && !rawQuery.isEmpty()) {
      sb.append('?').append(rawQuery);
    }
    return URI.create(sb.toString());
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
