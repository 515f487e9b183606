package com.openstable.sync.optimistic;

public enum MutationType {
    ADD,
    UPDATE,
    REMOVE
}
