package com.gentoro.lightdocs.search;

/**
 * One search hit. {@code score} is the fraction of distinct query tokens the document contains, in
 * {@code [0, 1]}. Collaborators link to {@code slug + ".html"}.
 */
public record SearchResult(String slug, String title, String excerpt, double score) {}
