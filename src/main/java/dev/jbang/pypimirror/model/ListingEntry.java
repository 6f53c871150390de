package dev.jbang.pypimirror.model;

/**
 * One artifact anchor of a package listing page.
 *
 * @param url absolute artifact URL, already stripped of query and fragment
 * @param filename link text of the anchor
 */
public record ListingEntry(String url, String filename) {}
