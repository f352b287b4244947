package com.riskrails.audit;

/**
 * Destination for audit records. Implementations must not throw: a failing sink never
 * changes the outcome of an execution.
 */
public interface AuditSink {

    void append(AuditRecord auditRecord);
}
