package com.vcsight.ingestor.extract;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A VM as recovered from an inventory document, before cleaning.
 *
 * Numeric fields keep the raw node exactly as found (number, numeric text,
 * garbage or null). Coercion to numbers with defaults happens once, in the
 * transform stage.
 */
public record VmRecord(
        String   name,
        String   uuid,
        String   powerState,
        JsonNode cpuCount,
        JsonNode memoryMb,
        JsonNode diskGb,
        JsonNode networkCount,
        String   guestOs,
        String   hostName,
        String   clusterName,
        String   datacenterName
) {}
