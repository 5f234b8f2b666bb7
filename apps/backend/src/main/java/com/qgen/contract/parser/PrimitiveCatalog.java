package com.qgen.contract.parser;

import com.qgen.contract.ast.PrimitiveKind;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps call names to primitive kinds. The built-in table covers the contract runtime's accessors;
 * deployments extend it through {@code qgen.audit.primitives}.
 */
public final class PrimitiveCatalog {

    private static final Map<PrimitiveKind, List<String>> BUILT_IN = Map.of(
            PrimitiveKind.AUTHORIZATION_CHECK, List.of("is_owner", "is_authorized", "is_admin", "check_owner", "has_role"),
            PrimitiveKind.AUTHORIZATION_ASSERT, List.of("require_owner", "require_authorized", "only_owner", "assert_owner"),
            PrimitiveKind.STATE_READ, List.of("load_bool_state", "load_long_long_state", "load_string_state",
                    "load_int_state", "load_state", "get_state"),
            PrimitiveKind.STATE_WRITE, List.of("save_bool_state", "save_long_long_state", "save_string_state",
                    "save_int_state", "save_state", "set_state", "delete_state"),
            PrimitiveKind.FUND_TRANSFER, List.of("send_funds", "transfer", "transfer_funds", "send"),
            PrimitiveKind.BALANCE_QUERY, List.of("get_contract_balance", "get_balance", "contract_balance"),
            PrimitiveKind.EXTERNAL_CALL, List.of("call_contract", "invoke_contract", "external_call"),
            PrimitiveKind.CHECKED_ARITHMETIC, List.of("safe_add", "safe_sub", "safe_mul", "checked_add",
                    "checked_sub", "checked_mul"),
            PrimitiveKind.PARAM_ACCESSOR, List.of("get_string_from_params", "get_long_long_from_params",
                    "get_bool_from_params", "get_int_from_params"),
            PrimitiveKind.RETURN_SETTER, List.of("set_string_return", "set_long_long_return", "set_bool_return",
                    "set_int_return")
    );

    private final Map<String, PrimitiveKind> byName;

    private PrimitiveCatalog(Map<String, PrimitiveKind> byName) {
        this.byName = Collections.unmodifiableMap(byName);
    }

    public static PrimitiveCatalog defaults() {
        return withExtensions(Map.of());
    }

    /** Built-in table plus extra names; an extension overrides a built-in name's kind. */
    public static PrimitiveCatalog withExtensions(Map<PrimitiveKind, ? extends Collection<String>> extensions) {
        Map<String, PrimitiveKind> names = new HashMap<>();
        BUILT_IN.forEach((kind, list) -> list.forEach(n -> names.put(n, kind)));
        if (extensions != null) {
            extensions.forEach((kind, list) -> {
                if (list != null) list.forEach(n -> names.put(n.trim(), kind));
            });
        }
        return new PrimitiveCatalog(names);
    }

    public PrimitiveKind kindOf(String name) {
        return byName.getOrDefault(name, PrimitiveKind.UNKNOWN);
    }

    public int size() {
        return byName.size();
    }
}
