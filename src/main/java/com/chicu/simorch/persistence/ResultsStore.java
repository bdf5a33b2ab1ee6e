package com.chicu.simorch.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Плоские JSON-документы, один файл на прогон. Существующий файл не перезаписывается.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultsStore {

    private final ObjectMapper objectMapper;
    private final ResultsProperties props;

    public Path write(String prefix, String runId, Object document) {
        Path dir = directory();
        Path file = dir.resolve(prefix + "_" + runId + ".json");
        try {
            Files.createDirectories(dir);
            byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
            Files.write(file, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            log.info("💾 RESULTS SAVED {}", file);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("results not saved: " + file, e);
        }
    }

    public Path directory() {
        return Paths.get(props.getDir());
    }
}
