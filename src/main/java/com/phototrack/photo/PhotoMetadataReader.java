package com.phototrack.photo;

import java.nio.file.Path;
import java.util.Optional;

import com.phototrack.model.PhotoMetadata;

public interface PhotoMetadataReader {

    /**
     * @return empty when the file carries no readable metadata; never throws
     */
    Optional<PhotoMetadata> read(Path photo);
}
