package com.company.signalanalytics.domain.enums;

public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    EXPIRED
}
