package com.flagship.custodial_exchange.ledger;

/**
 * Side of a ledger entry. Every transfer writes one DEBIT on the payer and one
 * CREDIT of the same amount on the payee.
 */
public enum EntryType {
    DEBIT,
    CREDIT
}
