package com.github.finiteautomaton;

/**
 * This represents the terminal state of a string check run.
 */
public enum RunOutcome {
  // all input consumed and the run ended on an accepting state
  ACCEPTED,
  // the current state had no outgoing transition for the next input character, the rest of the
  // input was never read
  REJECTED_STUCK,
  // all input consumed but the run ended on a non-accepting state
  REJECTED_NOT_ACCEPTING;
}
