package com.openstable.sync.model;

public enum ChangeType {
    INSERT,
    UPDATE,
    DELETE
}
