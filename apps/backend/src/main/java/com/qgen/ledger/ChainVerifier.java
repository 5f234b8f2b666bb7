package com.qgen.ledger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 按序号顺序校验：
 *   - sequence 是否连续（从 1 起）
 *   - prev_hash 是否等于上一条的 entry_hash
 *   - entry_hash 是否等于按自身字段重算的哈希
 * 返回首个断点与全部断言。
 */
public final class ChainVerifier {
    private ChainVerifier() {}

    public static ChainVerificationResult verify(String ledgerId, List<LedgerEntry> entries) {
        List<ChainBreak> breaks = new ArrayList<>();
        String prev = LedgerHasher.GENESIS;

        for (int i = 0; i < entries.size(); i++) {
            LedgerEntry e = entries.get(i);
            long expectSeq = i + 1L;
            String expectHash = LedgerHasher.expectedHash(e);

            boolean seqOk = e.sequence() == expectSeq;
            boolean prevOk = Objects.equals(e.prevHash(), prev);
            boolean hashOk = Objects.equals(e.entryHash(), expectHash);

            if (!(seqOk && prevOk && hashOk)) {
                breaks.add(new ChainBreak(e.sequence(), expectSeq, prev, e.prevHash(),
                        expectHash, e.entryHash(), seqOk, prevOk, hashOk));
            }
            // 按“实际链”推进，后续断点仍可定位
            prev = e.entryHash();
        }

        Long firstBad = breaks.isEmpty() ? null : breaks.get(0).getExpectedSequence();
        return new ChainVerificationResult(ledgerId, entries.size(), breaks.isEmpty(), firstBad, breaks, prev);
    }
}
