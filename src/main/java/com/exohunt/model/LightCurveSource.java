package com.exohunt.model;

/**
 * Where a light curve comes from. The identity string is the content-addressed part of the
 * cache key, so two sources with the same identity must yield the same bytes.
 */
public interface LightCurveSource {

    String identity();
}
