package com.github.finiteautomaton;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import com.github.finiteautomaton.FiniteAutomaton.FiniteAutomatonBuilder;
import com.github.finiteautomaton.FiniteAutomatonConfiguration.FiniteAutomatonConfigurationBuilder;
import com.github.finiteautomaton.FiniteAutomatonException.Code;

/**
 * Reads the JSON exchange document written by {@link FiniteAutomatonSerializer}.
 *
 * States are added before transitions, both in document order and through the regular mutation
 * API, so a document that breaks an automaton invariant fails with the same code the mutation
 * would have failed with. Malformed JSON and missing or mistyped fields fail with
 * {@link Code#PARSE_FAILURE}.
 */
public final class FiniteAutomatonParser {
  private static final Logger logger =
      LogManager.getLogger(FiniteAutomatonParser.class.getSimpleName());

  public static FiniteAutomaton parse(final String json) throws FiniteAutomatonException {
    if (json == null) {
      throw new FiniteAutomatonException(Code.PARSE_FAILURE, "Automaton document cannot be null");
    }
    try {
      final JSONObject document = new JSONObject(json);
      final FiniteAutomatonConfiguration config = FiniteAutomatonConfigurationBuilder.newBuilder()
          .alphabet(document.getString("alphabet"))
          .forceDeterminism(document.getBoolean("forceDeterminism")).build();
      final FiniteAutomaton finiteAutomaton =
          FiniteAutomatonBuilder.newBuilder().config(config).build();

      final JSONArray states = document.getJSONArray("states");
      for (int i = 0; i < states.length(); i++) {
        final JSONObject state = states.getJSONObject(i);
        finiteAutomaton.addState(state.getString("name"), readFlag(state, "accepting"),
            readFlag(state, "initial"));
      }

      final JSONArray transitions = document.getJSONArray("transitions");
      for (int i = 0; i < transitions.length(); i++) {
        final JSONObject transition = transitions.getJSONObject(i);
        finiteAutomaton.addTransition(transition.getString("startState"),
            transition.getString("targetState"), transition.getString("inputCharacters"));
      }
      if (logger.isDebugEnabled()) {
        logger.debug(String.format("[a:%s] Parsed automaton with %d states and %d transitions",
            finiteAutomaton.getId(), states.length(), transitions.length()));
      }
      return finiteAutomaton;
    } catch (JSONException problem) {
      throw new FiniteAutomatonException(Code.PARSE_FAILURE, problem.getMessage(), problem);
    }
  }

  /**
   * Absent flags are false, present ones have to be booleans.
   */
  private static boolean readFlag(final JSONObject state, final String key) {
    return state.has(key) && state.getBoolean(key);
  }

  private FiniteAutomatonParser() {}
}
