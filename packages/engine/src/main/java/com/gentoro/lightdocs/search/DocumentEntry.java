package com.gentoro.lightdocs.search;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Metadata stored per slug so search results can be shown without touching the source files. */
record DocumentEntry(@JsonProperty("title") String title, @JsonProperty("excerpt") String excerpt) {}
