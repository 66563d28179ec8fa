package io.b2mash.updatescheduler.notification;

import java.util.List;

/**
 * Outcome of notifying a schedule's recipients. Delivery is all-or-nothing from the caller's point
 * of view: one failed recipient makes the whole delivery failed.
 */
public record DeliveryResult(
    boolean delivered, List<String> failedRecipients, String errorMessage) {

  public DeliveryResult {
    failedRecipients = failedRecipients != null ? List.copyOf(failedRecipients) : List.of();
  }

  public static DeliveryResult success() {
    return new DeliveryResult(true, List.of(), null);
  }

  public static DeliveryResult failure(List<String> failedRecipients, String errorMessage) {
    return new DeliveryResult(false, failedRecipients, errorMessage);
  }
}
