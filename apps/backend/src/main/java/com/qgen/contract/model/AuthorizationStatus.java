package com.qgen.contract.model;

public enum AuthorizationStatus {
    GUARDED,
    UNGUARDED,
    /** an authorization check is on the path but does not provably gate the call */
    AMBIGUOUS
}
