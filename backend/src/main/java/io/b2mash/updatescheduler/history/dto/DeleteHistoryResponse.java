package io.b2mash.updatescheduler.history.dto;

public record DeleteHistoryResponse(int deletedCount) {}
