package com.qgen.ai;

/** Stands in when no chat model is configured. */
public class UnavailableContractSourceGenerator implements ContractSourceGenerator {

    @Override
    public GeneratedContract generate(String userPrompt) throws GenerationException {
        throw new GenerationException(GenerationException.Reason.UNAVAILABLE, "no chat model configured for code generation");
    }
}
