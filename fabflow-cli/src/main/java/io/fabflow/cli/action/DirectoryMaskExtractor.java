package io.fabflow.cli.action;

import io.fabflow.core.litho.MaskExtractor;
import io.fabflow.core.litho.MaskServiceUnavailableException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.logging.Logger;

/// {@link MaskExtractor} writing one mask file per lithography step into a local directory.
///
/// The mask for step `S` is written to `<directory>/mask_S.gds`. The layout reference is
/// resolved as a file path; its content is copied to the mask file unchanged, which stands in
/// for a layer-extracting mask service when the layout already holds a single layer.
///
/// ### Failure mapping
/// - layout file missing or unreadable -> {@link MaskServiceUnavailableException}
/// - mask directory cannot be created or written -> {@link MaskServiceUnavailableException}
/// - step identifier naming a file outside the directory -> {@link IllegalArgumentException}
///
/// @implNote Not thread-safe for concurrent extraction of the same step.
public final class DirectoryMaskExtractor implements MaskExtractor {

    private static final Logger logger = Logger.getLogger(DirectoryMaskExtractor.class.getName());

    static final String MASK_PREFIX = "mask_";
    static final String MASK_SUFFIX = ".gds";

    private final Path directory;

    /// Creates an extractor.
    ///
    /// @param directory directory receiving mask files, created on first use, not null
    public DirectoryMaskExtractor(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    @Override
    public String extractMask(String layoutReference, String stepIdentifier)
            throws MaskServiceUnavailableException {
        Objects.requireNonNull(layoutReference, "layoutReference must not be null");
        Objects.requireNonNull(stepIdentifier, "stepIdentifier must not be null");
        Path mask = maskPath(stepIdentifier);

        Path layout;
        try {
            layout = Path.of(layoutReference);
        } catch (InvalidPathException e) {
            throw new MaskServiceUnavailableException(
                    "Invalid layout reference " + layoutReference + ": " + e.getMessage(), e);
        }
        if (!Files.isRegularFile(layout) || !Files.isReadable(layout)) {
            throw new MaskServiceUnavailableException(
                    "Layout " + layoutReference + " for step " + stepIdentifier
                            + " is not a readable file");
        }

        try {
            Files.createDirectories(directory);
            Files.copy(layout, mask, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new MaskServiceUnavailableException(
                    "Cannot write mask " + mask + ": " + e.getMessage(), e);
        }
        logger.fine("Extracted mask for " + stepIdentifier + " to " + mask);
        return mask.toString();
    }

    /// Returns where the mask of a step is written.
    ///
    /// @param stepIdentifier lithography step identifier, not null
    /// @return mask file path, never null
    /// @throws IllegalArgumentException if the identifier does not name a file directly inside
    ///     the mask directory
    public Path maskPath(String stepIdentifier) {
        Path mask = directory.resolve(MASK_PREFIX + stepIdentifier + MASK_SUFFIX);
        Path base = directory.toAbsolutePath().normalize();
        if (!base.equals(mask.toAbsolutePath().normalize().getParent())) {
            throw new IllegalArgumentException(
                    "Step identifier " + stepIdentifier + " escapes mask directory " + directory);
        }
        return mask;
    }
}
