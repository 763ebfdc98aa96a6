package com.github.statechart;

/**
 * Unified single exception that's thrown and handled by this statechart runtime. The idea is to use
 * the code enum to encapsulate various error/exception conditions. Structural problems are always
 * reported at build time with the qualified path of the offending element in the message.
 *
 * Exceptions raised by user supplied guards, effects and activities are not wrapped in this type,
 * they surface unchanged as the cause of the failed future that awaited them.
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StateMachineException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_STRUCTURE("Statechart structure is malformed and cannot be compiled or executed"),
    // 2.
    MACHINE_NOT_ALIVE("State machine is not running and cannot service requests"),
    // 3.
    INVALID_MACHINE_CONFIG("State machine configuration is invalid"),
    // 4.
    ILLEGAL_EVENT("Event cannot be dispatched to the state machine"),
    // 5.
    UNKNOWN_CALL_EVENT("State machine failed to lookup call event with provided name"),
    // 6.
    UNKNOWN_ELEMENT("State machine failed to lookup element with provided name"),
    // 7.
    PROTOCOL_VIOLATION(
        "Pseudostate could not complete its compound transition, no outgoing transition was enabled"),
    // 8.
    INTERRUPTED("State machine was interrupted"),
    // 9.
    UNKNOWN_FAILURE(
        "State machine failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
