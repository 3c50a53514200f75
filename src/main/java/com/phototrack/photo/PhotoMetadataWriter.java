package com.phototrack.photo;

import java.nio.file.Path;

import com.phototrack.model.TrackPoint;

public interface PhotoMetadataWriter {

    /**
     * Writes the point's position, altitude and place names into the photo.
     *
     * @return false when the photo was not modified; never throws
     */
    boolean write(Path photo, TrackPoint point);
}
