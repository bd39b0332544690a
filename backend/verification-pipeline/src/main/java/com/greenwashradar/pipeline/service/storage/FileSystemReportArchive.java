package com.greenwashradar.pipeline.service.storage;

import com.greenwashradar.pipeline.dto.JobKey;
import com.greenwashradar.pipeline.dto.ReportDocument;
import com.greenwashradar.pipeline.dto.ReportDocumentRef;
import com.greenwashradar.pipeline.exception.DocumentNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Report archive on the local disk, one file per job key.
 */
@Component
@Slf4j
public class FileSystemReportArchive implements ReportArchive {

    private final Path root;

    public FileSystemReportArchive(@Value("${pipeline.storage.report-dir:./data/reports}") String reportDir) {
        this.root = Paths.get(reportDir).toAbsolutePath().normalize();
    }

    @Override
    public ReportDocumentRef store(JobKey key, ReportDocument document) {
        String archiveKey = key.asString() + ".pdf";
        Path target = root.resolve(archiveKey);
        try {
            Files.createDirectories(root);
            Path temp = Files.createTempFile(root, key.asString(), ".part");
            Files.write(temp, document.content());
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to archive report for " + key, e);
        }
        log.debug("Archived report {} ({} bytes)", target, document.size());
        return new ReportDocumentRef(archiveKey, document.sourceUrl(), document.contentType(),
                document.size(), sha256(document.content()));
    }

    @Override
    public ReportDocument load(ReportDocumentRef ref) {
        Path path = root.resolve(ref.archiveKey());
        if (!Files.exists(path)) {
            throw DocumentNotFoundException.inArchive(ref.archiveKey());
        }
        try {
            return new ReportDocument(ref.sourceUrl(), ref.contentType(), Files.readAllBytes(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read archived report " + path, e);
        }
    }

    @Override
    public void delete(ReportDocumentRef ref) {
        try {
            Files.deleteIfExists(root.resolve(ref.archiveKey()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete archived report " + ref.archiveKey(), e);
        }
    }

    private static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
