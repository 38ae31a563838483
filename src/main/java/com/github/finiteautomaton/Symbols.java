package com.github.finiteautomaton;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversions between the string form of a symbol sequence and its character list form.
 */
final class Symbols {

  static List<Character> toCharacters(final String symbols) {
    final List<Character> characters = new ArrayList<>(symbols.length());
    for (int i = 0; i < symbols.length(); i++) {
      characters.add(symbols.charAt(i));
    }
    return characters;
  }

  static String join(final List<Character> characters) {
    final StringBuilder builder = new StringBuilder(characters.size());
    for (final Character character : characters) {
      builder.append(character.charValue());
    }
    return builder.toString();
  }

  private Symbols() {}
}
