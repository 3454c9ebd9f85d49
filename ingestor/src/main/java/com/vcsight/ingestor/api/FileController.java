package com.vcsight.ingestor.api;

import com.vcsight.ingestor.api.dto.EnqueueRequest;
import com.vcsight.ingestor.api.dto.ValidationResponse;
import com.vcsight.ingestor.service.FileValidationService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.Path;

/**
 * POST /api/files/validate: dry run of decode and extraction for a file,
 * without creating a job. Always 200 once a path is given; the body says
 * what is wrong with the file, if anything.
 */
@RestController
@RequestMapping("/api/files")
public class FileController {

    private final FileValidationService validationService;

    public FileController(FileValidationService validationService) {
        this.validationService = validationService;
    }

    @PostMapping("/validate")
    public ValidationResponse validate(@RequestBody EnqueueRequest req) {
        if (req == null || req.filePath() == null || req.filePath().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "filePath is required");
        }
        return ValidationResponse.from(validationService.validate(Path.of(req.filePath())));
    }
}
