package io.b2mash.updatescheduler.owner;

/** Request header carrying the calling owner's id. */
public final class OwnerHeaders {

  public static final String OWNER_ID = "X-Owner-Id";

  private OwnerHeaders() {}
}
