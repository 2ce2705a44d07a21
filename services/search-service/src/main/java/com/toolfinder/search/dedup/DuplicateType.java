package com.toolfinder.search.dedup;

public enum DuplicateType {
    EXACT,
    NEAR,
    VERSION_VARIANT,
    PARTIAL
}
