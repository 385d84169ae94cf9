package com.company.signalanalytics.domain.enums;

/**
 * Who maintains the signal a segment belongs to.
 */
public enum Maintainer {
    ALL,
    ODOT,
    OTHERS
}
