package com.github.finiteautomaton;

import java.util.List;

/**
 * A finite automaton over a fixed alphabet. States and transitions are added incrementally and
 * never removed.
 *
 * Notes for users:<br>
 * 1. the alphabet and the forceDeterminism flag are fixed at construction<br>
 *
 * 2. if forceDeterminism is set, any addState() or addTransition() that would make the automaton
 * non-deterministic is rejected with {@link FiniteAutomatonException.Code#DETERMINISM_VIOLATION}.
 * Otherwise determinism is only checked when asked for via {@link #isDeterministic()} or when a
 * string is checked<br>
 *
 * 3. every mutation is all-or-nothing: a failed call leaves the automaton exactly as it was<br>
 *
 * 4. instances built by {@link FiniteAutomatonBuilder} are NOT thread-safe. Wrap them with
 * {@link FiniteAutomatonBuilder#locking(boolean)} if multiple threads share one automaton<br>
 *
 * 5. introspection methods return null rather than throwing when the queried state or transition
 * does not exist<br>
 */
public interface FiniteAutomaton {

  ///// Mutation API /////
  /**
   * Add a state that is neither accepting nor initial.
   */
  void addState(final String stateName) throws FiniteAutomatonException;

  /**
   * Add a state with the given name which can be accepting and/or initial.
   */
  void addState(final String stateName, final boolean accepting, final boolean initial)
      throws FiniteAutomatonException;

  /**
   * Add a transition from startStateName to targetStateName labeled with the given input
   * characters. Both states must already exist and there must not be a transition between them
   * yet.
   */
  void addTransition(final String startStateName, final String targetStateName,
      final List<Character> inputCharacters) throws FiniteAutomatonException;

  /**
   * Same as {@link #addTransition(String, String, List)} with every character of inputCharacters
   * as one input symbol.
   */
  void addTransition(final String startStateName, final String targetStateName,
      final String inputCharacters) throws FiniteAutomatonException;


  ///// Run API /////
  /**
   * Returns true iff this automaton is deterministic. Recomputed on every call.
   */
  boolean isDeterministic();

  /**
   * Returns true iff this automaton accepts the given string. Only deterministic automatons are
   * supported.
   */
  boolean checkString(final String string) throws FiniteAutomatonException;

  /**
   * Run the given string and report how the run terminated.
   */
  RunResult run(final String string) throws FiniteAutomatonException;


  ///// Introspection API /////
  /**
   * Reports the id of this automaton instance. Only used to tell instances apart in logs.
   */
  String getId();

  List<Character> getAlphabet();

  boolean isForceDeterminism();

  /**
   * Names of all states in insertion order.
   */
  List<String> getStateNames();

  /**
   * Number of states.
   */
  int size();

  /**
   * Returns whether the named state is initial, null if there is no such state.
   */
  Boolean isStateInitial(final String stateName);

  /**
   * Returns whether the named state is accepting, null if there is no such state.
   */
  Boolean isStateAccepting(final String stateName);

  /**
   * Names of the target states of the transitions leaving startStateName, null if there is no
   * such state.
   */
  List<String> getTransitions(final String startStateName);

  /**
   * Input characters of the transition from startStateName to targetStateName, null if either
   * state or the transition does not exist.
   */
  List<Character> getInputCharacters(final String startStateName, final String targetStateName);

  /**
   * A deep copy sharing nothing mutable with this automaton.
   */
  FiniteAutomaton copy();

  /**
   * A simple builder to let users use fluent APIs to build automatons.
   */
  public final static class FiniteAutomatonBuilder {
    private FiniteAutomatonConfiguration config;
    private boolean locking;
    private long lockAcquisitionMillis = LockingFiniteAutomaton.defaultLockAcquisitionMillis;

    public static FiniteAutomatonBuilder newBuilder() {
      return new FiniteAutomatonBuilder();
    }

    public FiniteAutomatonBuilder config(final FiniteAutomatonConfiguration config) {
      this.config = config;
      return this;
    }

    /**
     * Guard the built automaton with a readers-writer lock.
     */
    public FiniteAutomatonBuilder locking(final boolean locking) {
      this.locking = locking;
      return this;
    }

    public FiniteAutomatonBuilder lockAcquisitionMillis(final long lockAcquisitionMillis) {
      this.lockAcquisitionMillis = lockAcquisitionMillis;
      return this;
    }

    public FiniteAutomaton build() throws FiniteAutomatonException {
      if (config == null) {
        throw new FiniteAutomatonException(FiniteAutomatonException.Code.INVALID_AUTOMATON_CONFIG,
            "Automaton configuration cannot be null");
      }
      final FiniteAutomaton automaton = new FiniteAutomatonImpl(config);
      return locking ? new LockingFiniteAutomaton(automaton, lockAcquisitionMillis) : automaton;
    }

    private FiniteAutomatonBuilder() {}
  }

}
