package com.gigpulse.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gigpulse.core.forecast.ForecastTuning;
import com.gigpulse.core.forecast.ServiceCatalog;
import com.gigpulse.core.location.ReferenceCityCatalog;
import com.gigpulse.core.model.ReferenceCity;
import com.gigpulse.core.model.ServiceProfile;
import com.gigpulse.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    public static ForecasterConfig loadForecaster(Path configDir) {
        return read(configDir.resolve("forecaster.json"), new TypeReference<>() {
        });
    }

    public static ServiceCatalog loadServiceCatalog(Path configDir) {
        Path path = configDir.resolve("service-profiles.json");
        if (!Files.exists(path)) {
            return ServiceCatalog.defaults();
        }
        LOGGER.info("Using service profiles from " + path);
        return new ServiceCatalog(read(path, new TypeReference<List<ServiceProfile>>() {
        }));
    }

    public static ReferenceCityCatalog loadReferenceCities(Path configDir) {
        Path path = configDir.resolve("reference-cities.json");
        if (!Files.exists(path)) {
            return ReferenceCityCatalog.defaults();
        }
        LOGGER.info("Using reference cities from " + path);
        return new ReferenceCityCatalog(read(path, new TypeReference<List<ReferenceCity>>() {
        }));
    }

    public static ForecastTuning loadTuning(Path configDir) {
        Path path = configDir.resolve("forecast-tuning.json");
        if (!Files.exists(path)) {
            return ForecastTuning.defaults();
        }
        LOGGER.info("Using forecast tuning from " + path);
        return read(path, new TypeReference<ForecastTuning>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
