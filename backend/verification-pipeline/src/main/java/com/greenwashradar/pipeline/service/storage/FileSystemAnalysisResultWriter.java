package com.greenwashradar.pipeline.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.greenwashradar.pipeline.dto.AnalysisBundle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Writes {@code {jobKey}_result.json} for the report loader to pick up.
 * The file is replaced atomically, so a repeated hand-off overwrites rather than duplicates.
 */
@Component
@Slf4j
public class FileSystemAnalysisResultWriter implements AnalysisResultWriter {

    private final ObjectMapper objectMapper;
    private final Path root;

    public FileSystemAnalysisResultWriter(ObjectMapper objectMapper,
                                          @Value("${pipeline.storage.result-dir:./data/results}") String resultDir) {
        this.objectMapper = objectMapper;
        this.root = Paths.get(resultDir).toAbsolutePath().normalize();
    }

    @Override
    public void write(AnalysisBundle bundle) {
        Path target = root.resolve(bundle.jobKey() + "_result.json");
        try {
            Files.createDirectories(root);
            Path temp = Files.createTempFile(root, bundle.jobKey(), ".part");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), bundle);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write analysis result for " + bundle.jobKey(), e);
        }
        log.info("[{}] Analysis result written to {} ({} claims, {} evidence)",
                bundle.jobKey(), target, bundle.claims().size(), bundle.evidence().size());
    }
}
