package com.piiguard.domain.model;

/**
 * Display redaction rules applied to decrypted values.
 */
public enum MaskKind {
    /** 11-digit mobile number: 138****5678 */
    PHONE,

    /** 18-character resident ID: 110***********1234 */
    ID_CARD,

    /** Bank card of 12 or more digits: **** **** **** 7890 */
    BANK_CARD,

    /** Any other text: first 3 and last 4 characters when longer than 7, otherwise **** */
    GENERIC
}
