package com.github.finiteautomaton;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A single edge leaving its owning State. The start state is implicit, so the identity of a
 * transition within its state is its target name alone. The input characters are fixed at
 * creation; there's no way to add symbols to an existing transition.
 */
final class Transition {
  private final String targetStateName;
  private final List<Character> inputCharacters;

  /**
   * Repeated characters are collapsed, first occurrence wins the position.
   */
  Transition(final String targetStateName, final Collection<Character> inputCharacters) {
    this.targetStateName = targetStateName;
    this.inputCharacters =
        Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(inputCharacters)));
  }

  String getTargetStateName() {
    return targetStateName;
  }

  List<Character> getInputCharacters() {
    return inputCharacters;
  }

  boolean accepts(final char character) {
    return inputCharacters.contains(character);
  }

  Transition copy() {
    return new Transition(targetStateName, inputCharacters);
  }

  @Override
  public int hashCode() {
    return targetStateName.hashCode();
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
    return targetStateName.equals(((Transition) obj).targetStateName);
  }

  @Override
  public String toString() {
    return "Transition [targetState=" + targetStateName + ", inputCharacters=" + inputCharacters
        + "]";
  }
}
