package com.zookies.zkbackend.model.proof;

public enum OrchestratorState {
    UNINITIALIZED,
    INITIALIZING,
    READY
}
