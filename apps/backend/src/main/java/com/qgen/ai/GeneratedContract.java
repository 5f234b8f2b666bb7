package com.qgen.ai;

/**
 * @param code     extracted contract source
 * @param attempts model calls it took, 1-based
 */
public record GeneratedContract(String code, int attempts) {}
