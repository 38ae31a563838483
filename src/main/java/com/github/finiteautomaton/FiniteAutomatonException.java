package com.github.finiteautomaton;

/**
 * Unified single exception that's thrown and handled by this automaton library. The code enum
 * encapsulates the various error conditions so that callers can tell a structural mistake apart
 * from a determinism violation or a failed run without parsing messages.
 */
public final class FiniteAutomatonException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public FiniteAutomatonException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public FiniteAutomatonException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public FiniteAutomatonException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
  }

  public FiniteAutomatonException(final Code code, final String message,
      final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // structural
    DUPLICATE_STATE("State already exists"),
    UNKNOWN_STATE("State does not exist"),
    DUPLICATE_TRANSITION("There is already a transition between the given states"),
    INVALID_SYMBOL("The input characters have to be a non-empty subset of the alphabet"),
    INVALID_STATE_NAME("State name cannot be null"),
    // determinism
    DETERMINISM_VIOLATION("Mutation would make a deterministic automaton non-deterministic"),
    // run
    UNSUPPORTED_NFA("Checking strings is not implemented for non-deterministic automatons"),
    NO_INITIAL_STATE("This automaton does not have an initial state"),
    INVALID_INPUT("Input string cannot be null"),
    // setup and exchange
    INVALID_AUTOMATON_CONFIG("Automaton configuration is invalid"),
    PARSE_FAILURE("Failed to parse automaton document"),
    // locking decorator
    OPERATION_LOCK_ACQUISITION_FAILURE(
        "Failed to acquire read or write lock to perform requested operation. This is retryable."),
    INTERRUPTED("Automaton operation was interrupted");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
