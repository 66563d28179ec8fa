package io.b2mash.updatescheduler.history.dto;

import java.util.List;

public record HistoryPageResponse(
    List<HistoryEntryResponse> history, long total, int page, int size, boolean hasMore) {}
