package com.github.finiteautomaton;

/**
 * This object encapsulates the result of running an input string through a deterministic
 * FiniteAutomaton.
 *
 * {@link #getFinalStateName()} is the state the run was in when it terminated. For a stuck run
 * that is the state that had no transition for the character at index
 * {@link #getConsumedCharacters()}.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class RunResult {
  private final RunOutcome outcome;
  private final String finalStateName;
  private final int consumedCharacters;

  public RunResult(final RunOutcome outcome, final String finalStateName,
      final int consumedCharacters) {
    this.outcome = outcome;
    this.finalStateName = finalStateName;
    this.consumedCharacters = consumedCharacters;
  }

  public RunOutcome getOutcome() {
    return outcome;
  }

  public String getFinalStateName() {
    return finalStateName;
  }

  public int getConsumedCharacters() {
    return consumedCharacters;
  }

  public boolean isAccepted() {
    return outcome == RunOutcome.ACCEPTED;
  }

  @Override
  public String toString() {
    return "RunResult [outcome=" + outcome + ", finalStateName=" + finalStateName
        + ", consumedCharacters=" + consumedCharacters + "]";
  }
}
