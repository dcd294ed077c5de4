package in.execguard.application.port.output;

import in.execguard.domain.event.ResilienceEvent;

/**
 * Receives every resilience event for audit.
 */
public interface AuditSink {
    void record(ResilienceEvent event);
}
