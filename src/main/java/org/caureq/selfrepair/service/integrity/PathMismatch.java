package org.caureq.selfrepair.service.integrity;

public record PathMismatch(String path, Kind kind, String expectedDigest, String actualDigest) {
    public enum Kind { MODIFIED, MISSING, UNEXPECTED }

    /** Unexpected files are reported but do not count as tampering with protected content. */
    public boolean isViolation() { return kind != Kind.UNEXPECTED; }
}
