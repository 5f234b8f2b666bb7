package com.qgen.contract.ast;

/**
 * Closed set of primitive categories a contract call can resolve to.
 * Names that are not registered in the catalog resolve to {@link #UNKNOWN}.
 */
public enum PrimitiveKind {
    /** predicate such as {@code is_owner(in.sender)}; only its truth guards anything */
    AUTHORIZATION_CHECK,
    /** aborting check such as {@code require_owner(in.sender)} */
    AUTHORIZATION_ASSERT,
    STATE_READ,
    STATE_WRITE,
    FUND_TRANSFER,
    BALANCE_QUERY,
    EXTERNAL_CALL,
    CHECKED_ARITHMETIC,
    PARAM_ACCESSOR,
    RETURN_SETTER,
    UNKNOWN;

    public boolean isAuthorization() {
        return this == AUTHORIZATION_CHECK || this == AUTHORIZATION_ASSERT;
    }

    public boolean isExternalEffect() {
        return this == FUND_TRANSFER || this == EXTERNAL_CALL;
    }
}
