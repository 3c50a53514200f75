package com.phototrack.photo;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.phototrack.exception.PhotoTrackException;

/**
 * Recursive photo listing filtered by extension, sorted by path.
 * {@code *.backup} copies left by earlier syncs never match.
 */
public class PhotoScanner {

    static final String BACKUP_SUFFIX = ".backup";

    public List<Path> scan(Path directory, Collection<String> extensions) {
        if (!Files.isDirectory(directory)) {
            throw new PhotoTrackException("Folder " + directory + " does not exist");
        }
        Set<String> wanted = extensions.stream()
            .map(ext -> ext.toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
            .collect(Collectors.toSet());

        try (Stream<Path> paths = Files.walk(directory)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> matches(path, wanted))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new PhotoTrackException("Could not list " + directory + ": " + e.getMessage(), e);
        }
    }

    private static boolean matches(Path path, Set<String> extensions) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(BACKUP_SUFFIX)) {
            return false;
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 && extensions.contains(name.substring(dot + 1));
    }
}
