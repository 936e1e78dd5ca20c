package org.caureq.selfrepair.service.integrity;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.*;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Checksum-verified backups of a fixed set of protected files and directories.
 * <p>
 * A snapshot copies every protected file into {@code <backupRoot>/<id>/files} and records a SHA-256
 * manifest; the manifest is written last, so a directory without one is an incomplete snapshot.
 * Restores stage every file next to its target, check the staged digests, then swap them in with
 * atomic moves; any failure puts the previous contents back and reports the whole restore as failed.
 * All operations are serialized on this instance, so verification never observes a restore half-way.
 */
@Slf4j
public class IntegrityGuard {
    static final String MANIFEST = "manifest.json";
    static final String FILES = "files";
    private static final String ALGORITHM = "SHA-256";
    private static final String STAGING_SUFFIX = ".sr-staging";
    private static final String ROLLBACK_SUFFIX = ".sr-rollback";
    private static final Pattern SNAPSHOT_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");
    private static final DateTimeFormatter ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneOffset.UTC);

    private final List<Path> protectedPaths;
    private final Path backupRoot;
    private final int keep;
    private final Clock clock;
    private final ObjectMapper om = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public IntegrityGuard(List<Path> protectedPaths, Path backupRoot, int keep, Clock clock) {
        this.protectedPaths = normalize(protectedPaths);
        this.backupRoot = backupRoot.toAbsolutePath().normalize();
        this.keep = Math.max(1, keep);
        this.clock = clock;
    }

    public List<Path> protectedPaths() { return protectedPaths; }

    public boolean hasProtectedPaths() { return !protectedPaths.isEmpty(); }

    /* --------------------- snapshot --------------------- */

    public synchronized SnapshotManifest snapshot() {
        if (protectedPaths.isEmpty()) {
            throw new IntegrityException("no protected paths configured", null, List.of());
        }
        var now = clock.instant();
        var id = newId(now);
        var dir = backupRoot.resolve(id);
        try {
            Files.createDirectories(dir.resolve(FILES));
            var entries = new ArrayList<SnapshotManifest.Entry>();
            int i = 0;
            for (Path file : collectFiles(protectedPaths)) {
                String stored = "%06d.bin".formatted(++i);
                Path copy = dir.resolve(FILES).resolve(stored);
                Files.copy(file, copy);
                String digest = digest(copy);
                if (!digest.equals(digest(file))) {
                    throw new IntegrityException("file changed while snapshotting: " + file, id, List.of(file.toString()));
                }
                entries.add(new SnapshotManifest.Entry(file.toString(), digest, Files.size(copy), stored));
            }
            var manifest = new SnapshotManifest(id, now, ALGORITHM, List.copyOf(entries));
            writeManifest(dir, manifest);
            log.info("[Integrity] snapshot {} taken: {} files", id, entries.size());
            prune();
            return manifest;
        } catch (IOException e) {
            deleteTree(dir);
            throw new IntegrityException("snapshot failed: " + e.getMessage(), id, e);
        } catch (IntegrityException e) {
            deleteTree(dir);
            throw e;
        }
    }

    /** Newest first; incomplete snapshots are skipped. */
    public synchronized List<SnapshotManifest> listSnapshots() {
        if (!Files.isDirectory(backupRoot)) return List.of();
        var out = new ArrayList<SnapshotManifest>();
        try (Stream<Path> dirs = Files.list(backupRoot)) {
            dirs.filter(Files::isDirectory).forEach(d -> readManifest(d).ifPresent(out::add));
        } catch (IOException e) {
            throw new IntegrityException("cannot list snapshots in " + backupRoot, null, e);
        }
        out.sort(Comparator.comparing(SnapshotManifest::createdAt)
                .thenComparing(SnapshotManifest::id)
                .reversed());
        return out;
    }

    public synchronized Optional<SnapshotManifest> latestSnapshot() {
        return listSnapshots().stream().findFirst();
    }

    /* --------------------- verify --------------------- */

    /** Compares the protected set with the latest snapshot. */
    public synchronized VerificationReport verify() {
        return verify(null);
    }

    public synchronized VerificationReport verify(Collection<Path> subset) {
        var manifest = latestSnapshot().orElseThrow(() -> new SnapshotNotFoundException(null));
        return verifyAgainst(manifest, subset);
    }

    private VerificationReport verifyAgainst(SnapshotManifest manifest, Collection<Path> subset) {
        var roots = rootsFor(subset);
        Map<String, SnapshotManifest.Entry> expected = new LinkedHashMap<>();
        for (var e : manifest.entries()) {
            if (isUnder(Path.of(e.path()), roots)) expected.put(e.path(), e);
        }
        var mismatches = new ArrayList<PathMismatch>();
        for (var e : expected.values()) {
            Path p = Path.of(e.path());
            if (!Files.isRegularFile(p)) {
                mismatches.add(new PathMismatch(e.path(), PathMismatch.Kind.MISSING, e.digest(), null));
                continue;
            }
            String actual;
            try {
                actual = digest(p);
            } catch (IOException ex) {
                actual = null;
            }
            if (!e.digest().equals(actual)) {
                mismatches.add(new PathMismatch(e.path(), PathMismatch.Kind.MODIFIED, e.digest(), actual));
            }
        }
        try {
            for (Path f : collectFiles(roots)) {
                if (expected.containsKey(f.toString())) continue;
                String actual;
                try { actual = digest(f); } catch (IOException ex) { actual = null; }
                mismatches.add(new PathMismatch(f.toString(), PathMismatch.Kind.UNEXPECTED, null, actual));
            }
        } catch (IOException e) {
            throw new IntegrityException("cannot scan protected paths: " + e.getMessage(), manifest.id(), e);
        }
        mismatches.sort(Comparator.comparing(PathMismatch::path));
        return new VerificationReport(manifest.id(), clock.instant(), expected.size(), List.copyOf(mismatches));
    }

    /* --------------------- restore --------------------- */

    /** @param snapshotId an id, or {@code latest} (or null) for the newest snapshot whose copies are intact */
    public synchronized RestoreReport restore(String snapshotId) {
        return restore(snapshotId, null);
    }

    public synchronized RestoreReport restore(String snapshotId, Collection<Path> subset) {
        var roots = rootsFor(subset);
        var manifest = resolveForRestore(snapshotId, roots);
        var entries = manifest.entries().stream().filter(e -> isUnder(Path.of(e.path()), roots)).toList();
        if (entries.isEmpty()) {
            throw new IntegrityException("snapshot %s holds no files under %s".formatted(manifest.id(), roots),
                    manifest.id(), roots.stream().map(Path::toString).toList());
        }
        var filesDir = backupRoot.resolve(manifest.id()).resolve(FILES);
        var swaps = new ArrayList<Swap>();

        // 1. stage and check every file before touching any target
        try {
            for (var e : entries) {
                var swap = new Swap(e, manifest.id());
                swaps.add(swap);
                Files.createDirectories(swap.target.getParent());
                Files.copy(filesDir.resolve(e.stored()), swap.staging, StandardCopyOption.REPLACE_EXISTING);
                if (!e.digest().equals(digest(swap.staging))) {
                    throw new IntegrityException("staged copy does not match manifest: " + e.path(), manifest.id(), List.of(e.path()));
                }
            }
        } catch (IOException | IntegrityException ex) {
            swaps.forEach(s -> deleteQuietly(s.staging));
            if (ex instanceof IntegrityException ie) throw ie;
            throw new IntegrityException("restore from %s failed while staging: %s".formatted(manifest.id(), ex.getMessage()), manifest.id(), ex);
        }

        // 2. swap into place
        try {
            for (var s : swaps) {
                if (Files.exists(s.target, LinkOption.NOFOLLOW_LINKS)) {
                    move(s.target, s.rollback);
                    s.movedAside = true;
                }
                move(s.staging, s.target);
                s.placed = true;
            }
        } catch (IOException ex) {
            boolean clean = rollBack(swaps);
            throw new IntegrityException("restore from %s failed while swapping files (%s); previous contents %s"
                    .formatted(manifest.id(), ex.getMessage(), clean ? "put back" : "only partly put back"), manifest.id(), ex);
        }

        // 3. re-verify what was written
        var bad = new ArrayList<String>();
        for (var s : swaps) {
            try {
                if (!s.entry.digest().equals(digest(s.target))) bad.add(s.entry.path());
            } catch (IOException ex) {
                bad.add(s.entry.path());
            }
        }
        if (!bad.isEmpty()) {
            boolean clean = rollBack(swaps);
            log.error("[Integrity] restore from {} produced digest mismatches on {} (rolled back: {})", manifest.id(), bad, clean);
            throw new IntegrityException("restore from %s produced digest mismatches".formatted(manifest.id()), manifest.id(), bad);
        }
        swaps.forEach(s -> deleteQuietly(s.rollback));
        var restored = swaps.stream().map(s -> s.entry.path()).toList();
        log.info("[Integrity] restored {} files from snapshot {}", restored.size(), manifest.id());
        return new RestoreReport(manifest.id(), restored, clock.instant());
    }

    private SnapshotManifest resolveForRestore(String snapshotId, List<Path> roots) {
        if (snapshotId == null || snapshotId.isBlank() || "latest".equalsIgnoreCase(snapshotId)) {
            for (var m : listSnapshots()) {
                var corrupt = corruptCopies(m, roots);
                if (corrupt.isEmpty()) return m;
                log.warn("[Integrity] snapshot {} has corrupt copies {}, trying an older one", m.id(), corrupt);
            }
            throw new SnapshotNotFoundException(null);
        }
        if (!SNAPSHOT_ID.matcher(snapshotId).matches()) throw new SnapshotNotFoundException(snapshotId);
        var manifest = readManifest(backupRoot.resolve(snapshotId))
                .orElseThrow(() -> new SnapshotNotFoundException(snapshotId));
        var corrupt = corruptCopies(manifest, roots);
        if (!corrupt.isEmpty()) {
            throw new IntegrityException("snapshot %s has corrupt backup copies".formatted(snapshotId), snapshotId, corrupt);
        }
        return manifest;
    }

    private List<String> corruptCopies(SnapshotManifest m, List<Path> roots) {
        var filesDir = backupRoot.resolve(m.id()).resolve(FILES);
        var corrupt = new ArrayList<String>();
        for (var e : m.entries()) {
            if (!isUnder(Path.of(e.path()), roots)) continue;
            try {
                if (!e.digest().equals(digest(filesDir.resolve(e.stored())))) corrupt.add(e.path());
            } catch (IOException ex) {
                corrupt.add(e.path());
            }
        }
        return corrupt;
    }

    /** @return true when every swapped file got its previous contents back */
    private boolean rollBack(List<Swap> swaps) {
        boolean clean = true;
        for (int i = swaps.size() - 1; i >= 0; i--) {
            var s = swaps.get(i);
            try {
                if (s.placed) Files.deleteIfExists(s.target);
                if (s.movedAside) move(s.rollback, s.target);
            } catch (IOException e) {
                clean = false;
                log.error("[Integrity] could not roll back {}: {}", s.target, e.getMessage());
            }
            deleteQuietly(s.staging);
        }
        return clean;
    }

    /* --------------------- retention --------------------- */

    /** Keeps the newest {@code keep} snapshots and removes incomplete ones. */
    public synchronized int prune() {
        if (!Files.isDirectory(backupRoot)) return 0;
        int removed = 0;
        var snapshots = listSnapshots();
        for (int i = keep; i < snapshots.size(); i++) {
            deleteTree(backupRoot.resolve(snapshots.get(i).id()));
            removed++;
        }
        try (Stream<Path> dirs = Files.list(backupRoot)) {
            for (Path d : dirs.filter(Files::isDirectory).toList()) {
                if (!Files.exists(d.resolve(MANIFEST))) {
                    deleteTree(d);
                    removed++;
                }
            }
        } catch (IOException e) {
            throw new IntegrityException("cannot prune snapshots in " + backupRoot, null, e);
        }
        if (removed > 0) log.info("[Integrity] pruned {} snapshots (keep={})", removed, keep);
        return removed;
    }

    /* --------------------- utils --------------------- */

    static String digest(Path file) throws IOException {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buf = new byte[64 * 1024];
            int n;
            while ((n = in.read(buf)) > 0) md.update(buf, 0, n);
        }
        return HexFormat.of().formatHex(md.digest());
    }

    private List<Path> collectFiles(List<Path> roots) throws IOException {
        var files = new TreeSet<Path>();
        for (Path root : roots) {
            if (Files.isRegularFile(root)) {
                files.add(root);
            } else if (Files.isDirectory(root)) {
                try (Stream<Path> walk = Files.walk(root)) {
                    walk.filter(Files::isRegularFile)
                            .map(p -> p.toAbsolutePath().normalize())
                            .filter(p -> !p.startsWith(backupRoot))
                            .filter(p -> !isWorkFile(p))
                            .forEach(files::add);
                }
            }
        }
        return new ArrayList<>(files);
    }

    private List<Path> rootsFor(Collection<Path> subset) {
        return subset == null || subset.isEmpty() ? protectedPaths : normalize(subset);
    }

    private static boolean isUnder(Path p, List<Path> roots) {
        return roots.stream().anyMatch(p::startsWith);
    }

    private static boolean isWorkFile(Path p) {
        var name = p.getFileName().toString();
        return name.endsWith(STAGING_SUFFIX) || name.endsWith(ROLLBACK_SUFFIX);
    }

    private static List<Path> normalize(Collection<Path> paths) {
        if (paths == null) return List.of();
        return paths.stream().map(p -> p.toAbsolutePath().normalize()).distinct().toList();
    }

    private String newId(Instant now) {
        String base = ID_FORMAT.format(now);
        String id = base;
        for (int n = 1; Files.exists(backupRoot.resolve(id)); n++) id = base + "-" + n;
        return id;
    }

    private void writeManifest(Path dir, SnapshotManifest manifest) throws IOException {
        Path tmp = dir.resolve(MANIFEST + ".tmp");
        om.writeValue(tmp.toFile(), manifest);
        move(tmp, dir.resolve(MANIFEST));
    }

    private Optional<SnapshotManifest> readManifest(Path dir) {
        Path file = dir.resolve(MANIFEST);
        if (!Files.isRegularFile(file)) return Optional.empty();
        try {
            return Optional.of(om.readValue(file.toFile(), SnapshotManifest.class));
        } catch (IOException e) {
            log.warn("[Integrity] unreadable manifest {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private static void move(Path src, Path dst) throws IOException {
        try {
            Files.move(src, dst, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(src, dst, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("[Integrity] could not delete {}: {}", p, e.getMessage());
        }
    }

    private static void deleteTree(Path dir) {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(IntegrityGuard::deleteQuietly);
        } catch (IOException e) {
            log.warn("[Integrity] could not delete {}: {}", dir, e.getMessage());
        }
    }

    private static final class Swap {
        final SnapshotManifest.Entry entry;
        final Path target;
        final Path staging;
        final Path rollback;
        boolean movedAside;
        boolean placed;

        Swap(SnapshotManifest.Entry entry, String snapshotId) {
            this.entry = entry;
            this.target = Path.of(entry.path());
            String name = "." + target.getFileName() + "." + snapshotId;
            this.staging = target.resolveSibling(name + STAGING_SUFFIX);
            this.rollback = target.resolveSibling(name + ROLLBACK_SUFFIX);
        }
    }
}
