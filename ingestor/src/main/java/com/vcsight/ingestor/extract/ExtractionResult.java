package com.vcsight.ingestor.extract;

import java.util.List;

/** Everything recovered from one document. Empty lists are a valid result. */
public record ExtractionResult(List<VmRecord> vms, List<AlarmRecord> alarms) {

    public ExtractionResult {
        vms    = List.copyOf(vms);
        alarms = List.copyOf(alarms);
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(List.of(), List.of());
    }
}
