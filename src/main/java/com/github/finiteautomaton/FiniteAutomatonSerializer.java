package com.github.finiteautomaton;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Writes a FiniteAutomaton as a JSON exchange document:
 *
 * <pre>
 * {
 *   "alphabet": "ab",
 *   "forceDeterminism": true,
 *   "states": [{"name": "s0", "initial": true}, {"name": "s1", "accepting": true}],
 *   "transitions": [{"startState": "s0", "targetState": "s1", "inputCharacters": "a"}]
 * }
 * </pre>
 *
 * accepting and initial are only written when true. Only the public FiniteAutomaton API is used,
 * so any implementation, locking or not, can be serialized.
 */
public final class FiniteAutomatonSerializer {
  static final int indentFactor = 4;

  public static String serialize(final FiniteAutomaton finiteAutomaton) {
    return serialize(finiteAutomaton, false);
  }

  /**
   * If indent is true the document is indented with 4 spaces.
   */
  public static String serialize(final FiniteAutomaton finiteAutomaton, final boolean indent) {
    final JSONObject document = new JSONObject();
    document.put("alphabet", Symbols.join(finiteAutomaton.getAlphabet()));
    document.put("forceDeterminism", finiteAutomaton.isForceDeterminism());
    final JSONArray states = new JSONArray();
    document.put("states", states);
    final JSONArray transitions = new JSONArray();
    document.put("transitions", transitions);
    for (final String stateName : finiteAutomaton.getStateNames()) {
      final JSONObject state = new JSONObject();
      states.put(state);
      state.put("name", stateName);
      if (Boolean.TRUE.equals(finiteAutomaton.isStateAccepting(stateName))) {
        state.put("accepting", true);
      }
      if (Boolean.TRUE.equals(finiteAutomaton.isStateInitial(stateName))) {
        state.put("initial", true);
      }
      for (final String targetStateName : finiteAutomaton.getTransitions(stateName)) {
        final JSONObject transition = new JSONObject();
        transitions.put(transition);
        transition.put("startState", stateName);
        transition.put("targetState", targetStateName);
        transition.put("inputCharacters",
            Symbols.join(finiteAutomaton.getInputCharacters(stateName, targetStateName)));
      }
    }
    return document.toString(indent ? indentFactor : 0);
  }

  private FiniteAutomatonSerializer() {}
}
