package com.qgen.ledger;

import java.util.List;

/**
 * @param length                 number of entries in the verified snapshot
 * @param firstDivergentSequence expected sequence of the first broken entry, null when valid
 * @param tailHash               stored hash of the last entry, genesis for an empty chain
 */
public record ChainVerificationResult(String ledgerId,
                                      int length,
                                      boolean valid,
                                      Long firstDivergentSequence,
                                      List<ChainBreak> breaks,
                                      String tailHash) {

    public ChainVerificationResult {
        breaks = List.copyOf(breaks);
    }
}
