package com.exohunt.extractor;

/**
 * Turns raw source bytes into columns. Binary formats such as FITS are supplied by external
 * implementations registered as Spring beans; the extractor asks each provider in order.
 */
public interface LightCurveFormatProvider {

    /**
     * Short name used in logs and error messages.
     */
    String name();

    /**
     * Cheap sniffing check; must not fully parse the content.
     */
    boolean supports(byte[] content);

    /**
     * @throws com.exohunt.error.DataFormatException if the content cannot be read
     */
    RawLightCurve load(byte[] content);
}
