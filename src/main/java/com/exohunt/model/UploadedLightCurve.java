package com.exohunt.model;

import com.exohunt.error.DataFormatException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Raw light-curve bytes handed over by the caller (e.g., an uploaded file).
 *
 * <p>Identity is the SHA-256 of the content, computed once on construction, so re-uploads of the
 * same file share cache entries. Two uploads are equal when their content is equal, whatever
 * their file names.
 */
public final class UploadedLightCurve implements LightCurveSource {

    private final String fileName;
    private final byte[] content;
    private final String identity;

    public UploadedLightCurve(String fileName, byte[] content) {
        if (content == null || content.length == 0) throw new DataFormatException("Uploaded content must not be empty");
        this.fileName = fileName == null ? "upload" : fileName;
        this.content = content.clone();
        this.identity = "upload:" + sha256(this.content);
    }

    public static UploadedLightCurve ofText(String fileName, String text) {
        return new UploadedLightCurve(fileName, text.getBytes(StandardCharsets.UTF_8));
    }

    public String fileName() {
        return fileName;
    }

    /** The uploaded bytes; callers must not modify the returned array. */
    public byte[] content() {
        return content;
    }

    @Override
    public String identity() {
        return identity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UploadedLightCurve other)) return false;
        return identity.equals(other.identity);
    }

    @Override
    public int hashCode() {
        return identity.hashCode();
    }

    @Override
    public String toString() {
        return "UploadedLightCurve[" + fileName + ", " + content.length + " bytes, " + identity + "]";
    }

    private static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
