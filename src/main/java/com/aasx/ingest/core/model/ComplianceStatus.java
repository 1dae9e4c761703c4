package com.aasx.ingest.core.model;

/**
 * Whether an entity carries the identifying fields the shell standard makes mandatory.
 */
public enum ComplianceStatus {
    COMPLIANT,
    NON_COMPLIANT
}
