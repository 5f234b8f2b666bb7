package com.qgen;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Loads contract sources from src/test/resources/contracts. */
public final class ContractFixtures {
    private ContractFixtures() {}

    public static final String MALICIOUS = "mali_test.cpp";
    public static final String VOTING = "voting_contract.cpp";
    public static final String VAULT = "vault_contract.cpp";

    public static String load(String name) {
        try (InputStream in = ContractFixtures.class.getResourceAsStream("/contracts/" + name)) {
            if (in == null) throw new IllegalArgumentException("missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Wraps dispatch arms into a minimal entry function. */
    public static String contract(String arms) {
        return "outputStruct main(inputStruct in) {\n"
                + "    outputStruct out;\n"
                + arms + "\n"
                + "    return out;\n"
                + "}\n";
    }
}
