package com.ospicorp.regimesync.exception;

/**
 * A delete or submit step failed after the target resource was resolved. When
 * {@link #targetCleared()} is true the resource is left without values.
 */
public class PublishConsistencyException extends RegimeSyncException {
  private final String locationId;
  private final String targetLabel;
  private final String resourceId;
  private final boolean targetCleared;

  public PublishConsistencyException(String locationId, String targetLabel, String resourceId,
      boolean targetCleared, Throwable cause) {
    super("Publication of \"" + targetLabel + "\" at location " + locationId
        + " (resource " + resourceId + ") " + (targetCleared
            ? "left the target without values"
            : "could not clear existing values"), cause);
    this.locationId = locationId;
    this.targetLabel = targetLabel;
    this.resourceId = resourceId;
    this.targetCleared = targetCleared;
  }

  public String locationId() {
    return locationId;
  }

  public String targetLabel() {
    return targetLabel;
  }

  public String resourceId() {
    return resourceId;
  }

  public boolean targetCleared() {
    return targetCleared;
  }
}
