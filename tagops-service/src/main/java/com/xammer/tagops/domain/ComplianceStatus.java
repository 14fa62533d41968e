package com.xammer.tagops.domain;

/**
 * Last evaluated verdict for a resource. Every freshly observed resource starts as UNKNOWN.
 */
public enum ComplianceStatus {
    UNKNOWN,
    COMPLIANT,
    NON_COMPLIANT,
    EXEMPT
}
