package com.vcsight.ingestor.extract;

import java.time.Instant;

/**
 * An alarm as recovered from an inventory document.
 *
 * @param severity      raw severity, lower-cased ("unknown" when absent)
 * @param triggeredTime null when missing or not parseable
 */
public record AlarmRecord(
        String  name,
        String  description,
        String  severity,
        String  status,
        String  vmName,
        Instant triggeredTime,
        boolean acknowledged
) {}
