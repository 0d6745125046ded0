package com.flamingo.ai.tabbacklog.service.extraction;

import com.flamingo.ai.tabbacklog.service.extraction.model.ParsedPage;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Heuristic extractor for arbitrary HTML pages. Matches every http(s) URL and must be registered
 * last.
 */
@Component
public class GenericHtmlExtractor implements SiteExtractor {

  public static final String SITE_KIND = "generic_html";

  private static final String EXCLUDED_TAGS =
      "script, style, nav, header, footer, aside, noscript, iframe, form, button, input, select, "
          + "textarea, svg, canvas, video, audio";

  private static final List<String> CONTENT_SELECTORS = List.of("article", "main", "[role=main]");

  private static final String BLOCK_TAGS = "p, li, h1, h2, h3, h4, h5, h6";

  private static final List<String> TITLE_SEPARATORS =
      List.of(" | ", " - ", " \u2013 ", " \u2014 ", " :: ");

  private static final int MIN_BLOCK_CHARS = 20;

  @Override
  public String name() {
    return SITE_KIND;
  }

  @Override
  public boolean matches(String url) {
    return HtmlSupport.isHttpUrl(url);
  }

  @Override
  public ParsedPage extract(String url, String html) {
    Document doc = Jsoup.parse(html == null ? "" : html, url);

    String title = extractTitle(doc);
    Map<String, Object> metadata = extractMetadata(doc, url);
    String text = extractText(doc);

    return new ParsedPage(
        SITE_KIND, title, text, HtmlSupport.countWords(text), null, metadata);
  }

  private String extractTitle(Document doc) {
    String title = HtmlSupport.titleTag(doc);
    if (title != null) {
      return cleanTitle(title);
    }
    Element h1 = doc.selectFirst("h1");
    return h1 == null ? null : HtmlSupport.blankToNull(h1.text().trim());
  }

  /** Drops a trailing site name ("Article | Site") when the leading part is substantial. */
  static String cleanTitle(String title) {
    for (String separator : TITLE_SEPARATORS) {
      int idx = title.indexOf(separator);
      if (idx >= 0) {
        String first = title.substring(0, idx);
        if (first.length() > 10) {
          return first.trim();
        }
      }
    }
    return title.trim();
  }

  private String extractText(Document doc) {
    doc.select(EXCLUDED_TAGS).remove();

    Element container = null;
    for (String selector : CONTENT_SELECTORS) {
      container = doc.selectFirst(selector);
      if (container != null) {
        break;
      }
    }
    if (container == null) {
      container = doc.body();
    }
    if (container == null) {
      return null;
    }

    List<String> paragraphs = new ArrayList<>();
    for (Element block : container.select(BLOCK_TAGS)) {
      String text = block.text().trim();
      if (text.length() > MIN_BLOCK_CHARS) {
        paragraphs.add(text);
      }
    }
    if (!paragraphs.isEmpty()) {
      return String.join("\n\n", paragraphs);
    }

    String all = container.text();
    if (all.isBlank()) {
      return null;
    }
    return all.replaceAll("\\s+", " ").replaceAll("\\.{3,}", "...").trim();
  }

  private Map<String, Object> extractMetadata(Document doc, String url) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("url", url);
    metadata.put("domain", HtmlSupport.domain(url));

    putIfPresent(
        metadata,
        "description",
        HtmlSupport.meta(doc, "description", "og:description", "twitter:description"));
    putIfPresent(
        metadata, "author", HtmlSupport.meta(doc, "author", "og:author", "article:author"));
    putIfPresent(
        metadata,
        "published",
        HtmlSupport.meta(doc, "article:published_time", "datePublished", "date"));
    putIfPresent(metadata, "image", HtmlSupport.meta(doc, "og:image", "twitter:image"));
    putIfPresent(metadata, "site_name", HtmlSupport.meta(doc, "og:site_name"));
    putIfPresent(metadata, "type", HtmlSupport.meta(doc, "og:type"));

    Element canonical = doc.selectFirst("link[rel=canonical][href]");
    if (canonical != null) {
      putIfPresent(metadata, "canonical_url", canonical.attr("href"));
    }
    Element root = doc.selectFirst("html[lang]");
    if (root != null) {
      putIfPresent(metadata, "language", root.attr("lang"));
    }
    return metadata;
  }

  private static void putIfPresent(Map<String, Object> metadata, String key, String value) {
    if (value != null && !value.isBlank()) {
      metadata.put(key, value);
    }
  }
}
