package com.exohunt.visualization;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Time span of one predicted transit, for shading on a light-curve plot.
 */
public record TransitWindow(@JsonProperty("start") double start,
                            @JsonProperty("end") double end,
                            @JsonProperty("candidate") int candidateIndex) {
}
