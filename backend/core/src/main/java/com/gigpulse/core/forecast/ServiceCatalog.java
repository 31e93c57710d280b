package com.gigpulse.core.forecast;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gigpulse.core.model.ServiceId;
import com.gigpulse.core.model.ServiceProfile;
import com.gigpulse.core.util.JsonUtils;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class ServiceCatalog {
    private static final String BUNDLED = "service-profiles.json";

    private final Map<ServiceId, ServiceProfile> profiles = new EnumMap<>(ServiceId.class);

    public ServiceCatalog(List<ServiceProfile> profiles) {
        for (ServiceProfile profile : profiles) {
            if (this.profiles.put(profile.service(), profile) != null) {
                throw new IllegalArgumentException("Duplicate profile for " + profile.service());
            }
        }
    }

    public static ServiceCatalog defaults() {
        return new ServiceCatalog(JsonUtils.readResource(
                ServiceCatalog.class,
                BUNDLED,
                new TypeReference<List<ServiceProfile>>() {
                }
        ));
    }

    public ServiceProfile profile(ServiceId service) {
        ServiceProfile profile = profiles.get(service);
        if (profile == null) {
            throw new IllegalArgumentException("No profile configured for " + service.displayName());
        }
        return profile;
    }

    public Set<ServiceId> services() {
        return Collections.unmodifiableSet(profiles.keySet());
    }
}
