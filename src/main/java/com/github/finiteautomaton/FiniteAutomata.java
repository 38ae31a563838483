package com.github.finiteautomaton;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Static helpers over the public FiniteAutomaton API.
 */
public final class FiniteAutomata {

  /**
   * Returns true iff both automatons have the same alphabet, the same forceDeterminism flag, the
   * same states with the same flags and the same transitions with the same sets of input
   * characters. Insertion order of states and transitions is ignored, so is the automaton id.
   */
  public static boolean structurallyEqual(final FiniteAutomaton one, final FiniteAutomaton two) {
    if (one == two) {
      return true;
    }
    if (one == null || two == null) {
      return false;
    }
    if (!one.getAlphabet().equals(two.getAlphabet())
        || one.isForceDeterminism() != two.isForceDeterminism()) {
      return false;
    }
    final List<String> stateNames = one.getStateNames();
    if (!new HashSet<>(stateNames).equals(new HashSet<>(two.getStateNames()))) {
      return false;
    }
    for (final String stateName : stateNames) {
      if (!Objects.equals(one.isStateAccepting(stateName), two.isStateAccepting(stateName))
          || !Objects.equals(one.isStateInitial(stateName), two.isStateInitial(stateName))) {
        return false;
      }
      final List<String> targetStateNames = one.getTransitions(stateName);
      if (!new HashSet<>(targetStateNames).equals(new HashSet<>(two.getTransitions(stateName)))) {
        return false;
      }
      for (final String targetStateName : targetStateNames) {
        if (!new HashSet<>(one.getInputCharacters(stateName, targetStateName))
            .equals(new HashSet<>(two.getInputCharacters(stateName, targetStateName)))) {
          return false;
        }
      }
    }
    return true;
  }

  private FiniteAutomata() {}
}
