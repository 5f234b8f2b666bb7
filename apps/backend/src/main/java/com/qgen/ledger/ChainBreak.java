package com.qgen.ledger;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** 断点详情 */
@Getter
@ToString
@RequiredArgsConstructor
public class ChainBreak {
    private final long sequence;          // 存储的序号
    private final long expectedSequence;  // 按位置应有的序号（从 1 起）
    private final String expectPrev;
    private final String actualPrev;
    private final String expectHash;
    private final String actualHash;
    private final boolean sequenceMatch;
    private final boolean prevMatch;
    private final boolean hashMatch;
}
