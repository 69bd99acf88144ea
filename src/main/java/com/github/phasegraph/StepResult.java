package com.github.phasegraph;

import java.util.Optional;

/**
 * This object encapsulates the outcome of one compound {@link PhaseGraph#step()}.
 *
 * A result is produced even when nothing moved: both flags false simply means no guard held.
 * {@link #getStateId()} is empty only when the current phase's graph has no current node.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class StepResult {
  private final boolean phaseChanged;
  private final boolean stateChanged;
  private final String phaseId;
  private final String stateId;

  public StepResult(final boolean phaseChanged, final boolean stateChanged, final String phaseId,
      final String stateId) {
    this.phaseChanged = phaseChanged;
    this.stateChanged = stateChanged;
    this.phaseId = phaseId;
    this.stateId = stateId;
  }

  public boolean isPhaseChanged() {
    return phaseChanged;
  }

  public boolean isStateChanged() {
    return stateChanged;
  }

  public String getPhaseId() {
    return phaseId;
  }

  public Optional<String> getStateId() {
    return Optional.ofNullable(stateId);
  }

  @Override
  public String toString() {
    return "StepResult [phaseChanged=" + phaseChanged + ", stateChanged=" + stateChanged
        + ", phaseId=" + phaseId + ", stateId=" + stateId + "]";
  }
}
