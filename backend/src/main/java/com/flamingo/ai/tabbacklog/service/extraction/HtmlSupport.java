package com.flamingo.ai.tabbacklog.service.extraction;

import java.net.URI;
import java.util.Locale;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/** Small helpers shared by the extractors and the bookmark importer. */
public final class HtmlSupport {

  private static final String HTTP = "http://";
  private static final String HTTPS = "https://";

  private HtmlSupport() {}

  /**
   * True for URLs starting with {@code http://} or {@code https://} (any case) followed by
   * something. Hosts with underscores and unescaped spaces are accepted, as browsers export them.
   */
  public static boolean isHttpUrl(String url) {
    if (url == null) {
      return false;
    }
    String trimmed = url.trim();
    return schemeLength(trimmed) > 0 && trimmed.length() > schemeLength(trimmed);
  }

  private static int schemeLength(String url) {
    if (url.regionMatches(true, 0, HTTPS, 0, HTTPS.length())) {
      return HTTPS.length();
    }
    if (url.regionMatches(true, 0, HTTP, 0, HTTP.length())) {
      return HTTP.length();
    }
    return 0;
  }

  /** Lowercased host of an http(s) URL without port or credentials, or an empty string. */
  static String domain(String url) {
    if (!isHttpUrl(url)) {
      return "";
    }
    String rest = url.trim().substring(schemeLength(url.trim()));
    int end = rest.length();
    for (char stop : new char[] {'/', '?', '#'}) {
      int idx = rest.indexOf(stop);
      if (idx >= 0 && idx < end) {
        end = idx;
      }
    }
    String authority = rest.substring(0, end);
    authority = authority.substring(authority.lastIndexOf('@') + 1);
    int colon = authority.startsWith("[") ? authority.indexOf("]:") + 1 : authority.indexOf(':');
    if (colon > 0) {
      authority = authority.substring(0, colon);
    }
    return authority.toLowerCase(Locale.ROOT);
  }

  /** Path of the URL, or an empty string if it cannot be parsed. */
  static String path(String url) {
    try {
      String path = new URI(url.trim()).getPath();
      return path == null ? "" : path;
    } catch (Exception e) {
      return "";
    }
  }

  static int countWords(String text) {
    if (text == null || text.isBlank()) {
      return 0;
    }
    return text.trim().split("\\s+").length;
  }

  /**
   * Content of the first non-empty {@code <meta>} whose {@code name} or {@code property} equals
   * one of the keys, trying keys in order.
   */
  static String meta(Document doc, String... keys) {
    for (String key : keys) {
      for (String attr : new String[] {"name", "property"}) {
        for (Element meta : doc.getElementsByAttributeValue(attr, key)) {
          if ("meta".equals(meta.normalName()) && !meta.attr("content").isBlank()) {
            return meta.attr("content");
          }
        }
      }
    }
    return null;
  }

  /** True if any {@code <meta>} carries the given {@code property}. */
  static boolean hasMetaProperty(Document doc, String property) {
    return doc.getElementsByAttributeValue("property", property).stream()
        .anyMatch(e -> "meta".equals(e.normalName()));
  }

  /** Trimmed text of the {@code <title>} element, or null. */
  static String titleTag(Document doc) {
    Element title = doc.selectFirst("title");
    if (title == null) {
      return null;
    }
    String text = title.text().trim();
    return text.isEmpty() ? null : text;
  }

  static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
