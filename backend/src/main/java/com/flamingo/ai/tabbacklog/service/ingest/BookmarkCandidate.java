package com.flamingo.ai.tabbacklog.service.ingest;

import java.time.LocalDateTime;

/**
 * A link found in a tab collection of a bookmark export. Never stored as such; the ingest store
 * turns it into a tab.
 *
 * @param url trimmed http(s) URL
 * @param title link text, null if empty
 * @param collectionLabel label of the collection the link was found in
 * @param collectedAt when the link was saved
 */
public record BookmarkCandidate(
    String url, String title, String collectionLabel, LocalDateTime collectedAt) {}
