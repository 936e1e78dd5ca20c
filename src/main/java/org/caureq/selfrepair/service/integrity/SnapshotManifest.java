package org.caureq.selfrepair.service.integrity;

import java.time.Instant;
import java.util.List;

/** Digest manifest written as {@code manifest.json} inside each snapshot directory. */
public record SnapshotManifest(String id, Instant createdAt, String algorithm, List<Entry> entries) {

    /** @param stored file name of the copy under the snapshot's {@code files} directory */
    public record Entry(String path, String digest, long size, String stored) {}
}
