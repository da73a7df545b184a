package com.example.idm.domain.url;

import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Immutable URL whose query is always held as an ordered, decoded parameter map.
 * The query string only exists at {@link #format()} time, so a literal query can never
 * survive next to the structured one.
 */
public final class OutboundUrl {

  private final String scheme;
  private final String host;
  private final int port;
  private final String path;
  private final Map<String, List<String>> query;
  private final String fragment;

  private OutboundUrl(String scheme, String host, int port, String path,
                      Map<String, List<String>> query, String fragment) {
    this.scheme = scheme;
    this.host = host;
    this.port = port;
    this.path = path;
    this.query = query;
    this.fragment = fragment;
  }

  /**
   * Parse an absolute URL, form-decoding its query parameters.
   *
   * @throws IllegalArgumentException if the value is not an absolute URL
   */
  public static OutboundUrl parse(String url) {
    Objects.requireNonNull(url, "url");
    UriComponents components = UriComponentsBuilder.fromUriString(url).build();
    if (components.getScheme() == null || components.getHost() == null) {
      throw new IllegalArgumentException("Not an absolute URL: " + url);
    }

    Map<String, List<String>> query = new LinkedHashMap<>();
    MultiValueMap<String, String> raw = components.getQueryParams();
    raw.forEach((name, values) -> {
      List<String> decoded = new ArrayList<>(values.size());
      for (String value : values) {
        decoded.add(value == null ? null : decode(value));
      }
      query.put(decode(name), decoded);
    });

    return new OutboundUrl(
        components.getScheme(),
        components.getHost(),
        components.getPort(),
        components.getPath() == null ? "" : components.getPath(),
        query,
        components.getFragment());
  }

  /**
   * Same origin, new path, empty query.
   */
  public OutboundUrl withPath(String newPath) {
    return new OutboundUrl(scheme, host, port, newPath, new LinkedHashMap<>(), null);
  }

  /**
   * Set a query parameter, replacing any existing values. A {@code null} value removes it.
   */
  public OutboundUrl withQueryParam(String name, String value) {
    Map<String, List<String>> copy = copyQuery();
    if (value == null) {
      copy.remove(name);
    } else {
      copy.put(name, List.of(value));
    }
    return new OutboundUrl(scheme, host, port, path, copy, fragment);
  }

  /**
   * Set each entry as a query parameter in iteration order; {@code null} values are skipped.
   */
  public OutboundUrl withQueryParams(Map<String, String> params) {
    OutboundUrl url = this;
    for (Map.Entry<String, String> entry : params.entrySet()) {
      if (entry.getValue() != null) {
        url = url.withQueryParam(entry.getKey(), entry.getValue());
      }
    }
    return url;
  }

  public Optional<String> queryParam(String name) {
    List<String> values = query.get(name);
    if (values == null || values.isEmpty()) {
      return Optional.empty();
    }
    return Optional.ofNullable(values.get(0));
  }

  public Map<String, List<String>> queryParams() {
    return Collections.unmodifiableMap(query);
  }

  public String scheme() {
    return scheme;
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  public String path() {
    return path;
  }

  /**
   * Serialize with form-encoded query parameters.
   */
  public String format() {
    UriComponentsBuilder builder = UriComponentsBuilder.newInstance()
        .scheme(scheme)
        .host(host)
        .port(port)
        .path(path);

    String queryString = formatQuery();
    if (!queryString.isEmpty()) {
      builder.query(queryString);
    }
    if (fragment != null) {
      builder.fragment(fragment);
    }
    return builder.build(true).toUriString();
  }

  public URI toUri() {
    return URI.create(format());
  }

  @Override
  public String toString() {
    return format();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof OutboundUrl other)) return false;
    return format().equals(other.format());
  }

  @Override
  public int hashCode() {
    return format().hashCode();
  }

  private String formatQuery() {
    StringJoiner joiner = new StringJoiner("&");
    query.forEach((name, values) -> {
      for (String value : values) {
        joiner.add(value == null ? encode(name) : encode(name) + "=" + encode(value));
      }
    });
    return joiner.toString();
  }

  private Map<String, List<String>> copyQuery() {
    return new LinkedHashMap<>(query);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  private static String decode(String value) {
    return URLDecoder.decode(value, StandardCharsets.UTF_8);
  }
}
