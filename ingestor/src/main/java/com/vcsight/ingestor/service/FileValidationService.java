package com.vcsight.ingestor.service;

import com.vcsight.ingestor.ProcessingException;
import com.vcsight.ingestor.classify.EnvironmentClassifier;
import com.vcsight.ingestor.config.IngestProperties;
import com.vcsight.ingestor.extract.DocumentDecoder;
import com.vcsight.ingestor.extract.ExtractionResult;
import com.vcsight.ingestor.extract.InventoryExtractor;
import com.vcsight.ingestor.model.EnvironmentTag;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Dry run of the front half of the pipeline for one file: the checks the
 * watcher would apply, then decode and extract. Creates no job and writes
 * nothing.
 */
@Service
public class FileValidationService {

    private final IngestProperties      properties;
    private final EnvironmentClassifier classifier;
    private final DocumentDecoder       decoder;
    private final InventoryExtractor    extractor;

    public FileValidationService(IngestProperties properties,
                                 EnvironmentClassifier classifier,
                                 DocumentDecoder decoder,
                                 InventoryExtractor extractor) {
        this.properties = properties;
        this.classifier = classifier;
        this.decoder    = decoder;
        this.extractor  = extractor;
    }

    public record FileValidation(
            String         filePath,
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
        public boolean valid() {
            return exists && supportedExtension && withinSizeLimit && decodable;
        }
    }

    public FileValidation validate(Path file) {
        String path = JobService.normalize(file);
        EnvironmentTag tag = classifier.classifyFile(file);
        boolean supported = properties.isSupported(file);

        if (!Files.isRegularFile(file)) {
            return new FileValidation(path, false, supported, 0, false, false, 0, 0, tag,
                    "File not found: " + path);
        }

        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot stat " + path, e);
        }
        boolean withinLimit = size <= properties.maxFileSizeBytes();

        if (!supported) {
            return new FileValidation(path, true, false, size, withinLimit, false, 0, 0, tag,
                    "Unsupported file format: " + file.getFileName());
        }
        if (!withinLimit) {
            return new FileValidation(path, true, true, size, false, false, 0, 0, tag,
                    "File exceeds " + properties.getMaxFileSizeMb() + " MB");
        }

        try {
            ExtractionResult extraction = extractor.extract(decoder.decode(file));
            return new FileValidation(path, true, true, size, true, true,
                    extraction.vms().size(), extraction.alarms().size(), tag, null);
        } catch (ProcessingException e) {
            return new FileValidation(path, true, true, size, true, false, 0, 0, tag, e.getMessage());
        }
    }
}
