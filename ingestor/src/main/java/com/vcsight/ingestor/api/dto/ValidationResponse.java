package com.vcsight.ingestor.api.dto;

import com.vcsight.ingestor.model.EnvironmentTag;
import com.vcsight.ingestor.service.FileValidationService.FileValidation;

/** Response body for POST /api/files/validate. */
public record ValidationResponse(
        String         filePath,
        boolean        valid,
        boolean        exists,
        boolean        supportedExtension,
        long           sizeBytes,
        boolean        withinSizeLimit,
        boolean        decodable,
        int            vmCount,
        int            alarmCount,
        EnvironmentTag environment,
        String         error
) {
    public static ValidationResponse from(FileValidation v) {
        return new ValidationResponse(
                v.filePath(),
                v.valid(),
                v.exists(),
                v.supportedExtension(),
                v.sizeBytes(),
                v.withinSizeLimit(),
                v.decodable(),
                v.vmCount(),
                v.alarmCount(),
                v.environment(),
                v.error()
        );
    }
}
