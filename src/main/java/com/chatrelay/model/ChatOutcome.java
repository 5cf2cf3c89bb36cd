package com.chatrelay.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * Result of one coordinator operation. Failures are soft: the status names what went wrong and
 * the caller decides whether anything is reported back to the client.
 *
 * @param <T> payload produced by a successful operation
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ChatOutcome<T> {

    public enum Status {
        /** State changed and events went out. */
        APPLIED,
        /** Valid request that left shared state as it was (duplicate join). */
        UNCHANGED,
        VALIDATION_ERROR,
        /** No session for the connection; treated as a no-op. */
        UNKNOWN_SESSION,
        /** Message was not stored, so it was not broadcast either. */
        PERSISTENCE_FAILURE,
        INTERNAL_ERROR
    }

    Status status;
    T value;
    String detail;

    public static <T> ChatOutcome<T> applied(T value) {
        return new ChatOutcome<>(Status.APPLIED, value, null);
    }

    public static <T> ChatOutcome<T> unchanged(T value) {
        return new ChatOutcome<>(Status.UNCHANGED, value, null);
    }

    public static <T> ChatOutcome<T> validationError(String detail) {
        return new ChatOutcome<>(Status.VALIDATION_ERROR, null, detail);
    }

    public static <T> ChatOutcome<T> unknownSession(String connectionId) {
        return new ChatOutcome<>(Status.UNKNOWN_SESSION, null, "No session for connection " + connectionId);
    }

    public static <T> ChatOutcome<T> persistenceFailure(String detail) {
        return new ChatOutcome<>(Status.PERSISTENCE_FAILURE, null, detail);
    }

    public static <T> ChatOutcome<T> internalError(String detail) {
        return new ChatOutcome<>(Status.INTERNAL_ERROR, null, detail);
    }

    public boolean isSuccess() {
        return status == Status.APPLIED || status == Status.UNCHANGED;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }
}
