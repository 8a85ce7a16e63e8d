package com.decisionledger.logic;

/**
 * Raised by an {@link Evaluatable} when the logic itself fails. The engine
 * converts it into an execution error.
 */
public class LogicFailureException extends RuntimeException {

    public LogicFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
