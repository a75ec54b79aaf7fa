package com.lphedge.hedge.error;

import com.lphedge.hedge.CycleResult;

import java.util.Objects;

/**
 * The notifier failed after the rest of the cycle completed. Any hedge order in
 * {@link #completedCycle()} was already placed.
 */
public final class NotificationFailureException extends CollaboratorFailureException {

  private final transient CycleResult completedCycle;

  public NotificationFailureException(String collaborator, CycleResult completedCycle, Throwable cause) {
    super(collaborator, cause);
    this.completedCycle = Objects.requireNonNull(completedCycle, "completedCycle");
  }

  public CycleResult completedCycle() {
    return completedCycle;
  }
}
