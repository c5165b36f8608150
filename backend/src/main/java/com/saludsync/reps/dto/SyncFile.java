package com.saludsync.reps.dto;

import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Objects;

/** An uploaded REPS export, buffered in memory. */
public record SyncFile(String name, byte[] content) {

    public SyncFile {
        Objects.requireNonNull(content, "content must not be null");
        if (name == null || name.isBlank()) name = "archivo.xls";
    }

    public static SyncFile of(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) return null;
        return new SyncFile(file.getOriginalFilename(), file.getBytes());
    }
}
