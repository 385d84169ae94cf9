package com.company.signalanalytics.domain.enums;

public enum GeometryValidity {
    ALL,
    VALID,
    INVALID
}
