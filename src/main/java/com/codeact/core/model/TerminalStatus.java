package com.codeact.core.model;

public enum TerminalStatus {
    DONE,
    ABORTED
}
