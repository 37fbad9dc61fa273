package com.flagship.custodial_exchange.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * One side of a value transfer. Entries are immutable once written.
 */
@Value
public class LedgerEntry {
    UUID id;
    UUID transferId;
    String address;
    long amount;
    EntryType entryType;
    String description;
    Long sequenceNumber;
}
