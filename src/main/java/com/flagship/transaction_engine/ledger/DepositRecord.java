package com.flagship.transaction_engine.ledger;

import com.flagship.transaction_engine.transaction.ClientId;
import com.flagship.transaction_engine.transaction.PositiveAmount;
import lombok.Value;
import lombok.With;

/**
 * Ledger entry for a processed deposit.
 *
 * Immutable: toggling the dispute flag produces a new record that replaces the old one in the
 * {@link Ledger}.
 */
@Value
public class DepositRecord {
    ClientId clientId;
    PositiveAmount amount;
    @With
    boolean disputed;

    public static DepositRecord undisputed(ClientId clientId, PositiveAmount amount) {
        return new DepositRecord(clientId, amount, false);
    }

    /**
     * Whether this deposit was made by the given client.
     */
    public boolean belongsTo(ClientId client) {
        return clientId.equals(client);
    }
}
