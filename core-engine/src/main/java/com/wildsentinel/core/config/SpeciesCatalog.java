package com.wildsentinel.core.config;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only lookup of {@link SpeciesProfile}s by species name.
 *
 * <p>
 * Unknown species resolve to {@link SpeciesProfile#defaultProfile(String)},
 * so scoring never fails for a species the configuration does not list.
 * </p>
 *
 * @since 1.0.0
 */
public final class SpeciesCatalog {

    private final Map<String, SpeciesProfile> profiles;

    public SpeciesCatalog(Collection<SpeciesProfile> profiles) {
        Map<String, SpeciesProfile> byName = new LinkedHashMap<>();
        for (SpeciesProfile profile : profiles) {
            byName.put(profile.getName(), profile);
        }
        this.profiles = Map.copyOf(byName);
    }

    /**
     * @param species species name, any case
     * @return the configured profile, or the default profile
     */
    public SpeciesProfile profileFor(String species) {
        String key = normalize(species);
        SpeciesProfile profile = profiles.get(key);
        return profile != null ? profile : SpeciesProfile.defaultProfile(key);
    }

    public boolean isConfigured(String species) {
        return profiles.containsKey(normalize(species));
    }

    public int size() {
        return profiles.size();
    }

    private static String normalize(String species) {
        return species == null ? "" : species.trim().toLowerCase(Locale.ROOT);
    }
}
