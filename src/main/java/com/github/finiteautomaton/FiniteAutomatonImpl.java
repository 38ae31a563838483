package com.github.finiteautomaton;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.finiteautomaton.FiniteAutomatonException.Code;

/**
 * The state/transition store backing every FiniteAutomaton.
 *
 * Every mutation validates first and commits last, so a thrown FiniteAutomatonException always
 * leaves the store untouched. Determinism is enforced here only when forceDeterminism is set; the
 * predicate itself lives in {@link DeterminismValidator} and the run in
 * {@link AcceptanceSimulator}, both of which only read the store.
 *
 * Not thread-safe. See {@link LockingFiniteAutomaton}.
 */
final class FiniteAutomatonImpl implements FiniteAutomaton {
  private static final Logger logger =
      LogManager.getLogger(FiniteAutomatonImpl.class.getSimpleName());

  private final String automatonId = UUID.randomUUID().toString();

  private final List<Character> alphabet;
  private final boolean forceDeterminism;

  // K=state.name, V=state
  private final Map<String, State> states = new LinkedHashMap<>();

  FiniteAutomatonImpl(final FiniteAutomatonConfiguration config) {
    this.alphabet = config.getAlphabet();
    this.forceDeterminism = config.getForceDeterminism();
    logDebug(automatonId, "Created automaton with " + config);
  }

  private FiniteAutomatonImpl(final List<Character> alphabet, final boolean forceDeterminism) {
    this.alphabet = alphabet;
    this.forceDeterminism = forceDeterminism;
  }

  @Override
  public void addState(final String stateName) throws FiniteAutomatonException {
    addState(stateName, false, false);
  }

  @Override
  public void addState(final String stateName, final boolean accepting, final boolean initial)
      throws FiniteAutomatonException {
    if (stateName == null) {
      throw reject(Code.INVALID_STATE_NAME, Code.INVALID_STATE_NAME.getDescription());
    }
    if (forceDeterminism && initial) {
      final String initialStateName = findInitialStateName();
      if (initialStateName != null) {
        throw reject(Code.DETERMINISM_VIOLATION, String.format(
            "There can only be one initial state in a deterministic automaton, %s is already initial",
            initialStateName));
      }
    }
    if (states.containsKey(stateName)) {
      throw reject(Code.DUPLICATE_STATE, String.format("State %s already exists", stateName));
    }
    states.put(stateName, new State(stateName, accepting, initial));
    logDebug(automatonId, String.format("Added state %s [accepting=%s, initial=%s]", stateName,
        accepting, initial));
  }

  @Override
  public void addTransition(final String startStateName, final String targetStateName,
      final String inputCharacters) throws FiniteAutomatonException {
    addTransition(startStateName, targetStateName,
        inputCharacters == null ? null : Symbols.toCharacters(inputCharacters));
  }

  @Override
  public void addTransition(final String startStateName, final String targetStateName,
      final List<Character> inputCharacters) throws FiniteAutomatonException {
    final State startState = lookupState(startStateName);
    lookupState(targetStateName);
    if (startState.getTransition(targetStateName) != null) {
      throw reject(Code.DUPLICATE_TRANSITION,
          String.format("There is already a transition from state %s to state %s", startStateName,
              targetStateName));
    }
    if (inputCharacters == null || inputCharacters.isEmpty()) {
      throw reject(Code.INVALID_SYMBOL, String.format(
          "Transition from state %s to state %s needs at least one input character",
          startStateName, targetStateName));
    }
    if (!alphabet.containsAll(inputCharacters)) {
      final List<Character> foreign = new ArrayList<>(inputCharacters);
      foreign.removeAll(alphabet);
      throw reject(Code.INVALID_SYMBOL,
          String.format("The input characters have to be a subset of the alphabet %s, %s are not",
              alphabet, foreign));
    }
    if (forceDeterminism) {
      final String conflicting =
          DeterminismValidator.findConflictingTransition(startState, inputCharacters);
      if (conflicting != null) {
        throw reject(Code.DETERMINISM_VIOLATION, String.format(
            "In a deterministic automaton an input character can only be in one transition of a state, %s->%s already uses one of %s",
            startStateName, conflicting, inputCharacters));
      }
    }
    startState.attach(new Transition(targetStateName, inputCharacters));
    logDebug(automatonId, String.format("Added transition %s->%s on %s", startStateName,
        targetStateName, inputCharacters));
  }

  @Override
  public boolean isDeterministic() {
    return DeterminismValidator.isDeterministic(states.values());
  }

  @Override
  public boolean checkString(final String string) throws FiniteAutomatonException {
    return run(string).isAccepted();
  }

  @Override
  public RunResult run(final String string) throws FiniteAutomatonException {
    final RunResult result;
    try {
      result = AcceptanceSimulator.run(states, string);
    } catch (FiniteAutomatonException problem) {
      logDebug(automatonId, "Failed to run string: " + problem.getMessage());
      throw problem;
    }
    logDebug(automatonId, String.format("Ran string '%s' with %s", string, result));
    return result;
  }

  @Override
  public String getId() {
    return automatonId;
  }

  @Override
  public List<Character> getAlphabet() {
    return alphabet;
  }

  @Override
  public boolean isForceDeterminism() {
    return forceDeterminism;
  }

  @Override
  public List<String> getStateNames() {
    return new ArrayList<>(states.keySet());
  }

  @Override
  public int size() {
    return states.size();
  }

  @Override
  public Boolean isStateInitial(final String stateName) {
    final State state = states.get(stateName);
    return state == null ? null : state.isInitial();
  }

  @Override
  public Boolean isStateAccepting(final String stateName) {
    final State state = states.get(stateName);
    return state == null ? null : state.isAccepting();
  }

  @Override
  public List<String> getTransitions(final String startStateName) {
    final State state = states.get(startStateName);
    if (state == null) {
      return null;
    }
    final List<String> targetStateNames = new ArrayList<>();
    for (final Transition transition : state.getTransitions()) {
      targetStateNames.add(transition.getTargetStateName());
    }
    return targetStateNames;
  }

  @Override
  public List<Character> getInputCharacters(final String startStateName,
      final String targetStateName) {
    final State startState = states.get(startStateName);
    if (startState == null || !states.containsKey(targetStateName)) {
      return null;
    }
    final Transition transition = startState.getTransition(targetStateName);
    return transition == null ? null : transition.getInputCharacters();
  }

  @Override
  public FiniteAutomaton copy() {
    final FiniteAutomatonImpl copy = new FiniteAutomatonImpl(alphabet, forceDeterminism);
    for (final State state : states.values()) {
      copy.states.put(state.getName(), state.copy());
    }
    logDebug(automatonId, "Copied automaton to " + copy.automatonId);
    return copy;
  }

  @Override
  public String toString() {
    return "FiniteAutomaton [id=" + automatonId + ", forceDeterminism=" + forceDeterminism
        + ", alphabet=" + alphabet + ", states=" + states.values() + "]";
  }

  private State lookupState(final String stateName) throws FiniteAutomatonException {
    final State state = stateName == null ? null : states.get(stateName);
    if (state == null) {
      throw reject(Code.UNKNOWN_STATE, String.format("State %s does not exist", stateName));
    }
    return state;
  }

  private String findInitialStateName() {
    for (final State state : states.values()) {
      if (state.isInitial()) {
        return state.getName();
      }
    }
    return null;
  }

  private FiniteAutomatonException reject(final Code code, final String message) {
    logDebug(automatonId, "Rejected mutation: " + message);
    return new FiniteAutomatonException(code, message);
  }

  private static void logDebug(final String automatonId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[a:").append(automatonId).append("] ")
          .append(message).toString());
    }
  }

}
