package com.caselink.adapter;

/**
 * One {@code <item>} of an AMBER alert RSS feed, tagged with the feed it came
 * from.
 */
public record AmberFeedItem(
    String feedUrl,
    String title,
    String link,
    String description,
    String pubDate,
    String guid,
    String enclosureUrl,
    String contentEncoded
) {}
