package com.qbyte.gl_data.generator;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Journal metadata: where a transaction originated and what kind it is.
 */
@Component
public class JournalGenerator {

    static final List<String> JOURNAL_SOURCES = List.of("AP", "AR", "JIB", "PA", "PROD", "MANUAL", "ADJ");
    static final List<String> TRANSACTION_TYPES = List.of("INV", "PAY", "ADJ", "ALLOC", "ACCR", "REV");

    public String generateJournalSource(LedgerRandom random) {
        return random.choice(JOURNAL_SOURCES);
    }

    public String generateTransactionType(LedgerRandom random) {
        return random.choice(TRANSACTION_TYPES);
    }
}
