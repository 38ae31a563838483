package com.github.finiteautomaton;

import java.util.Collection;
import java.util.Map;

import com.github.finiteautomaton.FiniteAutomatonException.Code;

/**
 * Strict left-to-right, single pass simulation of a deterministic automaton. There is no
 * lookahead and no backtracking: the first character without a matching transition ends the run.
 *
 * Non-deterministic automatons are refused with {@link Code#UNSUPPORTED_NFA}. What acceptance
 * should mean for them (multi-state simulation or subset construction first) is still open.
 */
final class AcceptanceSimulator {

  static RunResult run(final Map<String, State> states, final String input)
      throws FiniteAutomatonException {
    if (input == null) {
      throw new FiniteAutomatonException(Code.INVALID_INPUT);
    }
    final Collection<State> allStates = states.values();
    if (!DeterminismValidator.isDeterministic(allStates)) {
      throw new FiniteAutomatonException(Code.UNSUPPORTED_NFA);
    }
    State currentState = findInitialState(allStates);
    if (currentState == null) {
      throw new FiniteAutomatonException(Code.NO_INITIAL_STATE);
    }
    for (int consumed = 0; consumed < input.length(); consumed++) {
      final Transition transition = currentState.findTransition(input.charAt(consumed));
      if (transition == null) {
        return new RunResult(RunOutcome.REJECTED_STUCK, currentState.getName(), consumed);
      }
      currentState = states.get(transition.getTargetStateName());
    }
    return new RunResult(
        currentState.isAccepting() ? RunOutcome.ACCEPTED : RunOutcome.REJECTED_NOT_ACCEPTING,
        currentState.getName(), input.length());
  }

  private static State findInitialState(final Collection<State> states) {
    for (final State state : states) {
      if (state.isInitial()) {
        return state;
      }
    }
    return null;
  }

  private AcceptanceSimulator() {}
}
