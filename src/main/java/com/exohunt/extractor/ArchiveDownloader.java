package com.exohunt.extractor;

/**
 * Resolves a catalog identifier to raw light-curve bytes from an external archive.
 */
public interface ArchiveDownloader {

    /**
     * @throws com.exohunt.error.FetchTimeoutException if the archive does not answer in time
     * @throws com.exohunt.error.DataFormatException   if the archive has no light curve for the target
     */
    byte[] download(long kepid);
}
