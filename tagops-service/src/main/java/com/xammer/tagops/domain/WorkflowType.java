package com.xammer.tagops.domain;

public enum WorkflowType {
    REMEDIATION,
    EXEMPTION
}
