package io.b2mash.updatescheduler.integration.email;

/** Outcome of a single provider send. */
public record SendResult(boolean success, String providerMessageId, String errorMessage) {}
