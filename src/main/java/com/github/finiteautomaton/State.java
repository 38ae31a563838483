package com.github.finiteautomaton;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * This object represents one automaton state and owns its outgoing transitions. A state is keyed
 * on its name only: two states with the same name are equal regardless of their flags.
 */
final class State {
  private final String name;
  private final boolean accepting;
  private final boolean initial;

  // K=transition.targetStateName, V=transition. Insertion ordered so that iteration, and with it
  // serialization, is stable.
  private final Map<String, Transition> transitions = new LinkedHashMap<>();

  State(final String name, final boolean accepting, final boolean initial) {
    this.name = name;
    this.accepting = accepting;
    this.initial = initial;
  }

  String getName() {
    return name;
  }

  boolean isAccepting() {
    return accepting;
  }

  boolean isInitial() {
    return initial;
  }

  Transition getTransition(final String targetStateName) {
    return transitions.get(targetStateName);
  }

  Collection<Transition> getTransitions() {
    return Collections.unmodifiableCollection(transitions.values());
  }

  /**
   * Callers are expected to have validated the transition already.
   */
  void attach(final Transition transition) {
    transitions.put(transition.getTargetStateName(), transition);
  }

  /**
   * First outgoing transition labeled with the given character, or null if the state is stuck on
   * it.
   */
  Transition findTransition(final char character) {
    for (final Transition transition : transitions.values()) {
      if (transition.accepts(character)) {
        return transition;
      }
    }
    return null;
  }

  State copy() {
    final State copy = new State(name, accepting, initial);
    for (final Transition transition : transitions.values()) {
      copy.attach(transition.copy());
    }
    return copy;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    return name.equals(((State) obj).name);
  }

  @Override
  public String toString() {
    return "State [name=" + name + ", accepting=" + accepting + ", initial=" + initial
        + ", transitions=" + transitions.values() + "]";
  }
}
