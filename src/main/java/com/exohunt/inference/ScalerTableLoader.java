package com.exohunt.inference;

import com.exohunt.error.ModelUnavailableException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Map;

/**
 * Reads the scaler table JSON that accompanies a model:
 *
 * <pre>
 * {
 *   "features": {
 *     "koi_period": { "mean": 31.5, "std": 80.2 },
 *     "koi_count":  { "mean": 1.4,  "std": 0.8, "default": 1 }
 *   }
 * }
 * </pre>
 */
public final class ScalerTableLoader {

    private static final Logger log = LoggerFactory.getLogger(ScalerTableLoader.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ScalerFile(@JsonProperty("features") Map<String, FeatureScaling> features) {
    }

    private ScalerTableLoader() {
    }

    public static ScalerTable load(Resource resource, ObjectMapper mapper) {
        try (InputStream in = resource.getInputStream()) {
            ScalerTable table = load(in, mapper);
            log.info("Loaded scaler table for {} features from {}", table.featureCount(), resource.getDescription());
            return table;
        } catch (IOException e) {
            throw new ModelUnavailableException("Cannot read scaler table " + resource.getDescription(), e);
        }
    }

    public static ScalerTable load(InputStream in, ObjectMapper mapper) throws IOException {
        ScalerFile file = mapper.readValue(in, ScalerFile.class);
        if (file.features() == null) throw new ModelUnavailableException("Scaler table has no \"features\" object");

        Map<KoiFeature, FeatureScaling> scalings = new EnumMap<>(KoiFeature.class);
        file.features().forEach((name, scaling) -> KoiFeature.fromLabel(name).ifPresentOrElse(
                feature -> scalings.put(feature, scaling),
                () -> log.debug("Ignoring scaler entry for unknown feature {}", name)));
        return new ScalerTable(scalings);
    }
}
