package com.flagship.transaction_engine.transaction;

import lombok.Value;

/**
 * Opaque identifier of a client.
 *
 * Client ids are 16-bit unsigned values. They support equality, ordering and hashing only;
 * there is deliberately no arithmetic and no implicit conversion to or from {@link TransactionId}.
 */
@Value
public class ClientId implements Comparable<ClientId> {

    public static final int MAX_VALUE = 0xFFFF;

    int value;

    private ClientId(int value) {
        this.value = value;
    }

    /**
     * @throws IllegalArgumentException if the value is negative or above {@link #MAX_VALUE}
     */
    public static ClientId of(int value) {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException(
                String.format("Client id must be between 0 and %d, got %d", MAX_VALUE, value));
        }
        return new ClientId(value);
    }

    @Override
    public int compareTo(ClientId other) {
        return Integer.compare(this.value, other.value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
