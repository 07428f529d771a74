package com.credit.card.fraud.scoring.artifact.service;

import com.credit.card.fraud.scoring.artifact.exceptions.ArtifactStoreException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.regex.Pattern;

/**
 * root/{modelVersion}/{key} 레이아웃의 파일 저장소
 */
@Slf4j
public class FileSystemArtifactStore implements ArtifactStore {

    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path root;

    public FileSystemArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public boolean exists(String modelVersion, String key) {
        return Files.isRegularFile(resolve(modelVersion, key));
    }

    @Override
    public byte[] read(String modelVersion, String key) {
        Path path = resolve(modelVersion, key);
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new ArtifactStoreException("Artifact not found: " + modelVersion + "/" + key, e);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read artifact " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void write(String modelVersion, String key, byte[] content) {
        Path path = resolve(modelVersion, key);
        try {
            Files.createDirectories(path.getParent());
            Files.write(path, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            log.info("Artifact written: {} ({} bytes)", path, content.length);
        } catch (FileAlreadyExistsException e) {
            throw new ArtifactStoreException("Artifact already exists and cannot be overwritten: "
                    + modelVersion + "/" + key, e);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to write artifact " + path + ": " + e.getMessage(), e);
        }
    }

    public Path root() {
        return root;
    }

    private Path resolve(String modelVersion, String key) {
        checkSegment("model version", modelVersion);
        checkSegment("artifact key", key);
        return root.resolve(modelVersion).resolve(key);
    }

    private static void checkSegment(String what, String segment) {
        if (segment == null || !SAFE_SEGMENT.matcher(segment).matches() || segment.contains("..")) {
            throw new ArtifactStoreException("Invalid " + what + ": " + segment);
        }
    }
}
