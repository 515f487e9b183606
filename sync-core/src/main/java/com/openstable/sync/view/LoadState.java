package com.openstable.sync.view;

public enum LoadState {
    IDLE,
    LOADING,
    READY,
    FAILED
}
