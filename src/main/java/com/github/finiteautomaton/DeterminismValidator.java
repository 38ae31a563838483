package com.github.finiteautomaton;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Decides whether a set of states forms a deterministic automaton. Nothing is cached; every call
 * recomputes the answer from the states handed in, irrespective of whether determinism was
 * enforced while they were being added.
 *
 * An automaton is deterministic iff:<br>
 * a. at most one state is initial<br>
 * b. no transition has an empty set of input characters<br>
 * c. no two outgoing transitions of the same state share an input character<br>
 */
final class DeterminismValidator {

  static boolean isDeterministic(final Collection<State> states) {
    int initialStates = 0;
    for (final State state : states) {
      if (state.isInitial() && ++initialStates > 1) {
        return false;
      }
      if (!hasDisjointTransitions(state)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Characters within one transition are distinct, so a character seen twice across the walk can
   * only come from two different transitions.
   */
  static boolean hasDisjointTransitions(final State state) {
    final Set<Character> usedCharacters = new HashSet<>();
    for (final Transition transition : state.getTransitions()) {
      if (transition.getInputCharacters().isEmpty()) {
        return false;
      }
      for (final Character character : transition.getInputCharacters()) {
        if (!usedCharacters.add(character)) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Name of the state's transition already labeled with any of the given characters, or null if
   * adding them would keep the state deterministic.
   */
  static String findConflictingTransition(final State state,
      final Collection<Character> inputCharacters) {
    for (final Transition transition : state.getTransitions()) {
      for (final Character character : inputCharacters) {
        if (transition.getInputCharacters().contains(character)) {
          return transition.getTargetStateName();
        }
      }
    }
    return null;
  }

  private DeterminismValidator() {}
}
