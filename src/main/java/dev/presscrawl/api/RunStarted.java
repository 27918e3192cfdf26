package dev.presscrawl.api;

import java.util.List;

/** Response of {@code POST /api/crawl/runs}: the sources whose crawl was started. */
public record RunStarted(List<String> sourceIds) {}
