package com.ospicorp.regimesync.sync;

/**
 * Outcome of one publication. {@code resourceId} is null when the target could not be
 * resolved.
 */
public record PublishResult(
    String label,
    String resourceId,
    PublishStatus status,
    boolean created,
    int eventCount,
    String message
) {

  public static PublishResult published(String label, String resourceId, boolean created,
      int eventCount) {
    return new PublishResult(label, resourceId, PublishStatus.PUBLISHED, created, eventCount, null);
  }

  public static PublishResult failed(String label, String resourceId, String message) {
    return new PublishResult(label, resourceId, PublishStatus.FAILED, false, 0, message);
  }

  public static PublishResult inconsistent(String label, String resourceId, String message) {
    return new PublishResult(label, resourceId, PublishStatus.INCONSISTENT, false, 0, message);
  }

  public static PublishResult skipped(String label, String message) {
    return new PublishResult(label, null, PublishStatus.SKIPPED, false, 0, message);
  }

  public enum PublishStatus {
    PUBLISHED,
    SKIPPED,
    FAILED,
    INCONSISTENT
  }
}
