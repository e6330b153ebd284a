package com.delta.siteaudit.audit.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class AuditUrls {

  private AuditUrls() {}

  /** Adds an https scheme when missing and rejects anything without a host. */
  public static String normalizeTarget(String input) {
    if (input == null || input.isBlank()) {
      throw new IllegalArgumentException("targetUrl is required");
    }
    String value = input.trim();
    if (!value.contains("://")) {
      value = "https://" + value;
    }
    URI uri = parse(value);
    if (uri == null || uri.getHost() == null) {
      throw new IllegalArgumentException("Invalid targetUrl: " + input);
    }
    String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException("Unsupported scheme for targetUrl: " + input);
    }
    return value;
  }

  public static String origin(String url) {
    URI uri = parse(url);
    if (uri == null || uri.getHost() == null) {
      return null;
    }
    String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
    String host = uri.getHost().toLowerCase(Locale.ROOT);
    return uri.getPort() > 0 ? scheme + "://" + host + ":" + uri.getPort() : scheme + "://" + host;
  }

  public static String rootUrl(String url) {
    String origin = origin(url);
    return origin == null ? null : origin + "/";
  }

  /** Host, path and query without the scheme, the form the audit API expects. */
  public static String withoutScheme(String url) {
    if (url == null) {
      return null;
    }
    String value = url.trim();
    int schemeEnd = value.indexOf("://");
    if (schemeEnd >= 0) {
      value = value.substring(schemeEnd + 3);
    }
    if (value.endsWith("/") && value.indexOf('/') == value.length() - 1) {
      value = value.substring(0, value.length() - 1);
    }
    return value;
  }

  public static String path(String url) {
    URI uri = parse(url);
    if (uri == null || uri.getRawPath() == null || uri.getRawPath().isBlank()) {
      return "/";
    }
    return uri.getRawPath();
  }

  public static boolean sameSite(String url, String origin) {
    String left = bareHost(url);
    String right = bareHost(origin);
    return left != null && left.equals(right);
  }

  /** Key used to drop duplicate sitemap entries: scheme-less, lower-case host, no trailing slash. */
  public static String dedupKey(String url) {
    URI uri = parse(url);
    if (uri == null || uri.getHost() == null) {
      return url;
    }
    String path = path(url);
    if (path.length() > 1 && path.endsWith("/")) {
      path = path.substring(0, path.length() - 1);
    }
    String query = uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery();
    return bareHost(url) + path + query;
  }

  private static String bareHost(String url) {
    URI uri = parse(url);
    if (uri == null || uri.getHost() == null) {
      return null;
    }
    String host = uri.getHost().toLowerCase(Locale.ROOT);
    return host.startsWith("www.") ? host.substring(4) : host;
  }

  private static URI parse(String url) {
    if (url == null || url.isBlank()) {
      return null;
    }
    try {
      return new URI(url.trim());
    } catch (URISyntaxException e) {
      return null;
    }
  }
}
