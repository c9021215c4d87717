package com.dingdangmaoup.contentpool.validation;

import com.dingdangmaoup.contentpool.model.ContentManifest;
import com.dingdangmaoup.contentpool.model.ContentSourceType;
import com.dingdangmaoup.contentpool.model.ManifestFile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Checks a manifest's internal consistency before it is admitted to the pool.
 * Pure: no I/O, and every problem is collected rather than stopping at the first.
 */
@Component
public class ManifestValidator {

    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:.*");

    public ValidationResult validate(ContentManifest manifest) {
        Objects.requireNonNull(manifest, "manifest");
        List<String> errors = new ArrayList<>();

        if (manifest.getId() == null || manifest.getId().value().isBlank()) {
            errors.add("Manifest ID is required");
        }
        if (isBlank(manifest.getName())) {
            errors.add("Manifest name is required");
        }
        if (isBlank(manifest.getVersion())) {
            errors.add("Manifest version is required");
        }

        List<ManifestFile> files = manifest.getFiles() == null ? List.of() : manifest.getFiles();
        List<String> directories = manifest.getRequiredDirectories() == null
                ? List.of() : manifest.getRequiredDirectories();
        boolean isBase = manifest.getContentType() != null && manifest.getContentType().isBase();
        if (files.isEmpty() && directories.isEmpty() && !isBase) {
            errors.add("Manifest must contain at least one file or required directory");
        }

        for (ManifestFile file : files) {
            if (file == null) {
                errors.add("File entries cannot be null");
                continue;
            }
            validateFile(file, errors);
        }

        for (String directory : directories) {
            if (isBlank(directory)) {
                errors.add("Required directories must not be empty");
            } else if (escapesRoot(directory)) {
                errors.add("Required directory " + directory + " contains illegal path traversal");
            }
        }

        return ValidationResult.of(errors);
    }

    private void validateFile(ManifestFile file, List<String> errors) {
        String path = file.getRelativePath();
        if (isBlank(path)) {
            errors.add("File entries must have a relative path");
        } else if (escapesRoot(path)) {
            errors.add("File " + path + " contains illegal path traversal");
        }

        String label = isBlank(path) ? "<unnamed>" : path;
        ContentSourceType sourceType = file.getSourceType();
        if (sourceType == null || sourceType == ContentSourceType.UNKNOWN) {
            errors.add("File " + label + " has unknown source type");
            return;
        }

        switch (sourceType) {
            case CONTENT_ADDRESSABLE -> {
                if (isBlank(file.getHash())) {
                    errors.add("Content file " + label + " must have a hash for content-addressable storage");
                }
            }
            case REMOTE_DOWNLOAD -> {
                if (isBlank(file.getDownloadUrl())) {
                    errors.add("Remote download file " + label + " must have a download URL");
                }
            }
            case PATCH_FILE -> {
                if (isBlank(file.getPatchSourceFile())) {
                    errors.add("Patch file " + label + " must have a patch source file");
                }
            }
            default -> {
                // no companion field
            }
        }
    }

    /**
     * True if the path is absolute or contains ".." anywhere
     */
    static boolean escapesRoot(String path) {
        String normalized = path.replace('\\', '/');
        return normalized.contains("..")
                || normalized.startsWith("/")
                || DRIVE_PREFIX.matcher(normalized).matches();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
