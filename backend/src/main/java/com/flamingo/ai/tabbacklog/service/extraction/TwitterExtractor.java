package com.flamingo.ai.tabbacklog.service.extraction;

import com.flamingo.ai.tabbacklog.service.extraction.model.ParsedPage;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

/**
 * Extractor for single posts on Twitter / X. The platform renders posts client-side, so content
 * comes only from the sharing meta tags.
 */
@Component
public class TwitterExtractor implements SiteExtractor {

  public static final String SITE_KIND = "twitter";

  private static final Set<String> DOMAINS =
      Set.of("twitter.com", "www.twitter.com", "mobile.twitter.com", "x.com", "www.x.com");

  private static final Pattern STATUS_PATH = Pattern.compile("/[^/]+/status/(\\d+)");

  private static final Pattern DISPLAY_NAME =
      Pattern.compile(
          "^([^(@]+?)(?:\\s+on\\s+(?:X|Twitter):|\\s*\\(@\\w+\\)\\s*/\\s*(?:X|Twitter))");

  @Override
  public String name() {
    return SITE_KIND;
  }

  @Override
  public boolean matches(String url) {
    if (!HtmlSupport.isHttpUrl(url) || !DOMAINS.contains(HtmlSupport.domain(url))) {
      return false;
    }
    return STATUS_PATH.matcher(HtmlSupport.path(url)).find();
  }

  @Override
  public ParsedPage extract(String url, String html) {
    Document doc = Jsoup.parse(html == null ? "" : html, url);

    String title = extractTitle(doc);
    String text = extractPostText(doc);
    String textFull = text != null ? text : title;

    return new ParsedPage(
        SITE_KIND,
        title,
        textFull,
        HtmlSupport.countWords(textFull),
        null,
        extractMetadata(doc, url));
  }

  private String extractTitle(Document doc) {
    String title = HtmlSupport.meta(doc, "og:title", "twitter:title");
    if (title != null) {
      return title;
    }
    String tag = HtmlSupport.titleTag(doc);
    if (tag == null) {
      return null;
    }
    if (tag.contains(" / X")) {
      return tag.replace(" / X", "");
    }
    return tag.replace(" / Twitter", "");
  }

  private String extractPostText(Document doc) {
    String og = HtmlSupport.meta(doc, "og:description");
    if (og != null) {
      if (og.length() >= 2 && og.startsWith("\"") && og.endsWith("\"")) {
        return og.substring(1, og.length() - 1);
      }
      return og;
    }
    return HtmlSupport.meta(doc, "twitter:description", "description");
  }

  private Map<String, Object> extractMetadata(Document doc, String url) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("url", url);
    metadata.put("domain", HtmlSupport.domain(url));
    metadata.put("platform", url.contains("twitter.com") ? "twitter" : "x");

    Map<String, Object> author = extractAuthor(doc, url);
    if (!author.isEmpty()) {
      metadata.put("author", author);
    }

    Matcher status = STATUS_PATH.matcher(HtmlSupport.path(url));
    if (status.find()) {
      metadata.put("tweet_id", status.group(1));
    }

    putIfPresent(metadata, "image", HtmlSupport.meta(doc, "og:image"));
    putIfPresent(metadata, "site_name", HtmlSupport.meta(doc, "og:site_name"));
    putIfPresent(metadata, "content_type", HtmlSupport.meta(doc, "og:type"));
    if (HtmlSupport.hasMetaProperty(doc, "og:video")) {
      metadata.put("has_video", true);
    }
    putIfPresent(metadata, "card_type", HtmlSupport.meta(doc, "twitter:card"));
    return metadata;
  }

  private Map<String, Object> extractAuthor(Document doc, String url) {
    Map<String, Object> author = new LinkedHashMap<>();

    String path = HtmlSupport.path(url);
    String trimmed = path.startsWith("/") ? path.substring(1) : path;
    if (!trimmed.isEmpty()) {
      author.put("username", trimmed.split("/")[0]);
    }

    String title = HtmlSupport.titleTag(doc);
    if (title != null) {
      Matcher m = DISPLAY_NAME.matcher(title);
      if (m.find()) {
        author.put("display_name", m.group(1).trim());
      }
    }

    putIfPresent(author, "twitter_handle", HtmlSupport.meta(doc, "twitter:creator"));
    return author;
  }

  private static void putIfPresent(Map<String, Object> map, String key, String value) {
    if (value != null && !value.isBlank()) {
      map.put(key, value);
    }
  }
}
