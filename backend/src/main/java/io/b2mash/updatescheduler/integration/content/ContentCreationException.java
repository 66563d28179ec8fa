package io.b2mash.updatescheduler.integration.content;

/** Raised by a {@link ContentProvider} when an artifact could not be produced. */
public class ContentCreationException extends RuntimeException {

  public ContentCreationException(String message) {
    super(message);
  }

  public ContentCreationException(String message, Throwable cause) {
    super(message, cause);
  }
}
