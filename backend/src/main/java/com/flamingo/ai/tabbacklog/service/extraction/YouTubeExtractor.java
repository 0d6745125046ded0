package com.flamingo.ai.tabbacklog.service.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.tabbacklog.service.extraction.model.ParsedPage;
import com.flamingo.ai.tabbacklog.service.extraction.video.VideoMetadataTool;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

/**
 * Extractor for YouTube videos. Metadata, including duration, comes from the external video
 * metadata tool; when the tool fails the fetched page is parsed instead and the result is flagged
 * with {@code fallback_used}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class YouTubeExtractor implements SiteExtractor {

  public static final String SITE_KIND = "youtube";

  private static final List<Pattern> URL_PATTERNS =
      List.of(
          Pattern.compile("^(?:https?://)?(?:www\\.)?youtube\\.com/watch\\?v=[\\w-]+"),
          Pattern.compile("^(?:https?://)?(?:www\\.)?youtube\\.com/shorts/[\\w-]+"),
          Pattern.compile("^(?:https?://)?youtu\\.be/[\\w-]+"),
          Pattern.compile("^(?:https?://)?(?:www\\.)?youtube\\.com/embed/[\\w-]+"),
          Pattern.compile("^(?:https?://)?(?:www\\.)?youtube\\.com/v/[\\w-]+"));

  private static final Set<String> DOMAINS = Set.of("youtube.com", "www.youtube.com", "youtu.be");

  private static final Pattern ID_PATH = Pattern.compile("^/(shorts|embed|v)/([^/?]+)");

  private static final List<String> METADATA_FIELDS =
      List.of(
          "uploader",
          "uploader_id",
          "channel",
          "channel_id",
          "upload_date",
          "view_count",
          "like_count",
          "comment_count",
          "thumbnail");

  private static final String TITLE_SUFFIX = " - YouTube";

  private final VideoMetadataTool videoMetadataTool;
  private final ObjectMapper objectMapper;

  @Override
  public String name() {
    return SITE_KIND;
  }

  @Override
  public boolean matches(String url) {
    if (url == null) {
      return false;
    }
    for (Pattern pattern : URL_PATTERNS) {
      if (pattern.matcher(url).find()) {
        return true;
      }
    }
    return DOMAINS.contains(HtmlSupport.domain(url));
  }

  @Override
  public ParsedPage extract(String url, String html) {
    JsonNode info;
    try {
      info = videoMetadataTool.fetch(url);
    } catch (RuntimeException e) {
      log.warn(
          "Video metadata lookup failed for {}, parsing page instead: {}", url, e.getMessage());
      return fallback(url, html, e.getMessage());
    }
    return fromToolOutput(url, info);
  }

  private ParsedPage fromToolOutput(String url, JsonNode info) {
    String title = text(info, "title");
    String description = text(info, "description");

    List<String> parts = new ArrayList<>();
    if (title != null) {
      parts.add(title);
    }
    if (description != null) {
      parts.add(description);
    }
    String textFull = parts.isEmpty() ? null : String.join("\n\n", parts);

    Integer duration =
        info.hasNonNull("duration") ? (int) Math.round(info.get("duration").asDouble()) : null;

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("url", url);
    putNode(metadata, "video_id", info.get("id"));
    for (String field : METADATA_FIELDS) {
      putNode(metadata, field, info.get(field));
    }
    metadata.put("categories", listOrEmpty(info.get("categories")));
    metadata.put("tags", listOrEmpty(info.get("tags")));
    metadata.put("is_live", info.path("is_live").asBoolean(false));
    metadata.put("was_live", info.path("was_live").asBoolean(false));

    return new ParsedPage(
        SITE_KIND, title, textFull, HtmlSupport.countWords(textFull), duration, metadata);
  }

  private ParsedPage fallback(String url, String html, String error) {
    Document doc = Jsoup.parse(html == null ? "" : html, url);

    String title = HtmlSupport.titleTag(doc);
    if (title != null && title.endsWith(TITLE_SUFFIX)) {
      title = HtmlSupport.blankToNull(title.substring(0, title.length() - TITLE_SUFFIX.length()));
    }
    String description = HtmlSupport.meta(doc, "description");

    List<String> parts = new ArrayList<>();
    if (title != null) {
      parts.add(title);
    }
    if (description != null) {
      parts.add(description);
    }
    String textFull = parts.isEmpty() ? null : String.join("\n\n", parts);

    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("url", url);
    String videoId = videoId(url);
    if (videoId != null) {
      metadata.put("video_id", videoId);
    }
    metadata.put("parse_error", error);
    metadata.put("fallback_used", true);

    return new ParsedPage(
        SITE_KIND, title, textFull, HtmlSupport.countWords(textFull), null, metadata);
  }

  /** Video id from watch, shorts, embed and short-link URLs. */
  static String videoId(String url) {
    URI uri;
    try {
      uri = new URI(url.trim());
    } catch (Exception e) {
      return null;
    }
    String host = uri.getHost() == null ? "" : uri.getHost();
    String path = uri.getPath() == null ? "" : uri.getPath();

    if (host.contains("youtube.com")) {
      if ("/watch".equals(path) && uri.getRawQuery() != null) {
        for (String param : uri.getRawQuery().split("&")) {
          if (param.startsWith("v=")) {
            return param.substring(2);
          }
        }
        return null;
      }
      Matcher m = ID_PATH.matcher(path);
      return m.find() ? m.group(2) : null;
    }
    if (host.contains("youtu.be")) {
      String id = path.startsWith("/") ? path.substring(1) : path;
      id = id.split("/")[0];
      return id.isEmpty() ? null : id;
    }
    return null;
  }

  private void putNode(Map<String, Object> metadata, String key, JsonNode node) {
    if (node != null && !node.isNull()) {
      metadata.put(key, objectMapper.convertValue(node, Object.class));
    }
  }

  private List<Object> listOrEmpty(JsonNode node) {
    List<Object> values = new ArrayList<>();
    if (node != null && node.isArray()) {
      node.forEach(v -> values.add(objectMapper.convertValue(v, Object.class)));
    }
    return values;
  }

  private static String text(JsonNode info, String field) {
    JsonNode node = info.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    return HtmlSupport.blankToNull(node.asText());
  }
}
