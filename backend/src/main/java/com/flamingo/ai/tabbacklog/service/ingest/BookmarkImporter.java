package com.flamingo.ai.tabbacklog.service.ingest;

import com.flamingo.ai.tabbacklog.config.PipelineConfig;
import com.flamingo.ai.tabbacklog.exception.BookmarkFileFormatException;
import com.flamingo.ai.tabbacklog.service.extraction.HtmlSupport;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

/**
 * Reads Netscape-format bookmark exports (as written by Firefox). Only folders whose name starts
 * with the configured collection prefix are read; the rest of the name becomes the collection
 * label. Pure transform, no I/O.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BookmarkImporter {

  private final PipelineConfig pipelineConfig;

  /**
   * Extracts the http(s) links of every tab collection.
   *
   * @throws BookmarkFileFormatException if the document is not a bookmark export
   */
  public List<BookmarkCandidate> parse(String exportDocument) {
    List<BookmarkCandidate> candidates = new ArrayList<>();
    for (Element folder : collectionFolders(load(exportDocument))) {
      Element list = folderContents(folder);
      if (list == null) {
        continue;
      }
      String label = labelOf(folder);
      for (Element link : list.select("a[href]")) {
        String url = link.attr("href").trim();
        if (!HtmlSupport.isHttpUrl(url)) {
          continue;
        }
        String title = link.text().trim();
        candidates.add(
            new BookmarkCandidate(
                url, title.isEmpty() ? null : title, label, collectedAt(link.attr("add_date"))));
      }
    }
    log.info("Parsed {} bookmark(s) from tab collections", candidates.size());
    return candidates;
  }

  /**
   * Counts collections and links without building candidates.
   *
   * @throws BookmarkFileFormatException if the document is not a bookmark export
   */
  public ImportStats stats(String exportDocument) {
    List<ImportStats.CollectionCount> collections = new ArrayList<>();
    int total = 0;
    for (Element folder : collectionFolders(load(exportDocument))) {
      Element list = folderContents(folder);
      if (list == null) {
        continue;
      }
      int count =
          (int)
              list.select("a[href]").stream()
                  .filter(a -> HtmlSupport.isHttpUrl(a.attr("href").trim()))
                  .count();
      collections.add(new ImportStats.CollectionCount(labelOf(folder), count));
      total += count;
    }
    return new ImportStats(collections.size(), total, collections);
  }

  private Document load(String exportDocument) {
    if (exportDocument == null || exportDocument.isBlank()) {
      throw new BookmarkFileFormatException("Bookmark file is empty");
    }
    Document doc = Jsoup.parse(exportDocument);
    if (doc.selectFirst("dl") == null) {
      throw new BookmarkFileFormatException("Bookmark file contains no bookmark lists");
    }
    return doc;
  }

  private List<Element> collectionFolders(Document doc) {
    String prefix = pipelineConfig.getIngest().getCollectionPrefix();
    return doc.select("h3").stream().filter(h3 -> h3.text().trim().startsWith(prefix)).toList();
  }

  /** The link list of a folder is the first {@code <dl>} after its header. */
  private static Element folderContents(Element folderHeader) {
    for (Element sibling : folderHeader.nextElementSiblings()) {
      if ("dl".equals(sibling.normalName())) {
        return sibling;
      }
    }
    return null;
  }

  private String labelOf(Element folderHeader) {
    PipelineConfig.Ingest ingest = pipelineConfig.getIngest();
    String label = folderHeader.text().trim().substring(ingest.getCollectionPrefix().length());
    return label.isEmpty() ? ingest.getDefaultCollectionLabel() : label;
  }

  /** Epoch seconds from {@code ADD_DATE} as UTC; now (UTC) when absent or unreadable. */
  private static LocalDateTime collectedAt(String addDate) {
    if (addDate == null || addDate.isBlank()) {
      return LocalDateTime.now(ZoneOffset.UTC);
    }
    try {
      return LocalDateTime.ofInstant(
          Instant.ofEpochSecond(Long.parseLong(addDate.trim())), ZoneOffset.UTC);
    } catch (RuntimeException e) {
      log.debug("Ignoring unreadable ADD_DATE '{}'", addDate);
      return LocalDateTime.now(ZoneOffset.UTC);
    }
  }
}
