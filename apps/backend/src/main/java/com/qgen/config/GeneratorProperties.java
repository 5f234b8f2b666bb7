package com.qgen.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "qgen.generator")
public class GeneratorProperties {
    private int maxAttempts = 3;
    private String systemPrompt = """
            You are an expert smart-contract engineer for the Qubic network.
            Write a complete C++ contract with a single entry function that dispatches on
            in.functionName. Use only the designated state, parameter and fund-transfer primitives.
            Check authorization before any privileged operation and guard arithmetic against overflow.
            Wrap the code between [C++ START] and [C++ END] and output nothing else.""";
    /** 为 false 时报告始终保持英文 */
    private boolean translationEnabled = true;
}
