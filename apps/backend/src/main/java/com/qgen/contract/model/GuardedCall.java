package com.qgen.contract.model;

import com.qgen.contract.ast.Expr;
import com.qgen.contract.ast.PrimitiveKind;

import java.util.Set;

/**
 * A state write, fund transfer or external call together with the authorization fact at its
 * call site and the state its arguments were derived from.
 *
 * @param domain             state keys flowing into the arguments (for writes: the written key)
 * @param balanceFunded      a balance query flows into the arguments
 * @param callerScoped       the write is keyed by the caller, or the transfer is funded only from
 *                           the caller's own state
 */
public record GuardedCall(Expr.Invocation invocation,
                          int line,
                          AuthorizationFact authorization,
                          Set<String> domain,
                          boolean balanceFunded,
                          boolean callerScoped) {

    public GuardedCall {
        domain = Set.copyOf(domain);
    }

    public PrimitiveKind kind() {
        return invocation.kind();
    }

    public String render() {
        return invocation.render();
    }
}
