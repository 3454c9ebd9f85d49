package com.vcsight.ingestor.api.dto;

/** Request body for POST /api/jobs and POST /api/files/validate. */
public record EnqueueRequest(String filePath) {}
