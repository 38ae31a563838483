package com.github.finiteautomaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This class encapsulates the construction-time parameters of a FiniteAutomaton. Use the
 * {@code FiniteAutomatonConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. the alphabet is copied and frozen, later changes to the caller's list are not seen.<br>
 * 2. duplicate symbols in the alphabet are tolerated, only membership is ever consulted.<br>
 * 3. forceDeterminism defaults to false, in which case determinism is only checked on demand.<br>
 */
public final class FiniteAutomatonConfiguration {
  private final List<Character> alphabet;
  private final boolean forceDeterminism;

  public List<Character> getAlphabet() {
    return alphabet;
  }

  public boolean getForceDeterminism() {
    return forceDeterminism;
  }

  public final static class FiniteAutomatonConfigurationBuilder {
    private List<Character> alphabet;
    private boolean forceDeterminism;

    public static FiniteAutomatonConfigurationBuilder newBuilder() {
      return new FiniteAutomatonConfigurationBuilder();
    }

    public FiniteAutomatonConfigurationBuilder alphabet(final List<Character> alphabet) {
      this.alphabet = alphabet;
      return this;
    }

    /**
     * Every character of the given string becomes one symbol of the alphabet.
     */
    public FiniteAutomatonConfigurationBuilder alphabet(final String alphabet) {
      this.alphabet = alphabet == null ? null : Symbols.toCharacters(alphabet);
      return this;
    }

    public FiniteAutomatonConfigurationBuilder forceDeterminism(final boolean forceDeterminism) {
      this.forceDeterminism = forceDeterminism;
      return this;
    }

    public FiniteAutomatonConfiguration build() throws FiniteAutomatonException {
      validate(alphabet);
      return new FiniteAutomatonConfiguration(alphabet, forceDeterminism);
    }

    private FiniteAutomatonConfigurationBuilder() {}
  }

  private static void validate(final List<Character> alphabet) throws FiniteAutomatonException {
    StringBuilder messages = new StringBuilder();
    if (alphabet == null) {
      messages.append("Alphabet cannot be null. ");
    } else if (alphabet.contains(null)) {
      messages.append("Alphabet cannot contain null symbols. ");
    }
    if (messages.length() > 0) {
      throw new FiniteAutomatonException(FiniteAutomatonException.Code.INVALID_AUTOMATON_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "FiniteAutomatonConfiguration [alphabet=" + alphabet + ", forceDeterminism="
        + forceDeterminism + "]";
  }

  private FiniteAutomatonConfiguration(final List<Character> alphabet,
      final boolean forceDeterminism) {
    this.alphabet = Collections.unmodifiableList(new ArrayList<>(alphabet));
    this.forceDeterminism = forceDeterminism;
  }

}
