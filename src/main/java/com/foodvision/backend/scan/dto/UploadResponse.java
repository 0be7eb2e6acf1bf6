package com.foodvision.backend.scan.dto;

public record UploadResponse(String jobId) {}
