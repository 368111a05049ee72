package com.trellis.http;

/** Thrown when a response is mutated after it has been finalized. */
public class AlreadySentException extends IllegalStateException {
  public static final String MESSAGE = "Cannot set response after it has been sent";

  private final String operation;

  /**
   * Creates a new exception for the rejected mutator.
   *
   * @param operation the mutator that was called, e.g. "status"
   */
  public AlreadySentException(String operation) {
    super(MESSAGE);
    this.operation = operation;
  }

  /**
   * Gets the name of the mutator that was rejected.
   *
   * @return the operation name
   */
  public String getOperation() {
    return operation;
  }
}
