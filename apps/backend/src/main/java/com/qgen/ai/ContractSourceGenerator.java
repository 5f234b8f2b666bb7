package com.qgen.ai;

/**
 * Turns a natural-language request into contract source.
 */
public interface ContractSourceGenerator {

    GeneratedContract generate(String userPrompt) throws GenerationException;
}
