package com.wildsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Data-driven description of one species: expected size on frame, activity
 * pattern and danger level.
 *
 * <p>
 * Adding a species is a configuration change, never a code change:
 * </p>
 *
 * <pre>
 * species:
 *   - name: raccoon
 *     minSize: 0.02
 *     maxSize: 0.25
 *     activePeriods: [night, dusk]
 *     inactivePeriods: [day]
 * </pre>
 *
 * @since 1.0.0
 */
public class SpeciesProfile implements Serializable {

    private static final long serialVersionUID = 1L;

    /** How dangerous a species is to people or livestock. */
    public enum DangerLevel {
        NONE,
        DANGEROUS,
        CRITICAL_DANGER
    }

    private String name;
    /** Expected bounding-box area as a fraction of the frame. */
    private double minSize = 0.01;
    private double maxSize = 0.9;
    private Set<String> activePeriods = new LinkedHashSet<>();
    private Set<String> inactivePeriods = new LinkedHashSet<>();
    /** Below this temperature (°C) the species is unlikely to be active; NaN disables. */
    private double minActiveTemperature = Double.NaN;
    private DangerLevel dangerLevel = DangerLevel.NONE;
    private boolean rare;

    /**
     * @return the profile applied to species with no configured entry
     */
    public static SpeciesProfile defaultProfile(String name) {
        SpeciesProfile profile = new SpeciesProfile();
        profile.setName(name);
        return profile;
    }

    /**
     * @param errors collector for validation problems
     */
    void validate(List<String> errors) {
        if (name == null || name.isBlank()) {
            errors.add("Species profile 'name' is required");
            return;
        }
        if (minSize < 0 || maxSize > 1 || minSize > maxSize) {
            errors.add("Species '" + name + "' requires 0 <= minSize <= maxSize <= 1");
        }
        List<String> overlap = new ArrayList<>(activePeriods);
        overlap.retainAll(inactivePeriods);
        if (!overlap.isEmpty()) {
            errors.add("Species '" + name + "' lists " + overlap + " as both active and inactive");
        }
        for (String period : activePeriods) {
            checkPeriod(period, errors);
        }
        for (String period : inactivePeriods) {
            checkPeriod(period, errors);
        }
    }

    private void checkPeriod(String period, List<String> errors) {
        if (!DayPeriod.isKnown(period)) {
            errors.add("Species '" + name + "' has unknown period '" + period
                    + "'. Supported: " + DayPeriod.names());
        }
    }

    private static Set<String> normalize(Set<String> values) {
        if (values == null) {
            return new LinkedHashSet<>();
        }
        return values.stream()
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    /**
     * Set the species name, normalised to lowercase.
     */
    public void setName(String name) {
        this.name = name != null ? name.trim().toLowerCase(Locale.ROOT) : null;
    }

    public double getMinSize() {
        return minSize;
    }

    public void setMinSize(double minSize) {
        this.minSize = minSize;
    }

    public double getMaxSize() {
        return maxSize;
    }

    public void setMaxSize(double maxSize) {
        this.maxSize = maxSize;
    }

    public Set<String> getActivePeriods() {
        return Collections.unmodifiableSet(activePeriods);
    }

    public void setActivePeriods(Set<String> activePeriods) {
        this.activePeriods = normalize(activePeriods);
    }

    public Set<String> getInactivePeriods() {
        return Collections.unmodifiableSet(inactivePeriods);
    }

    public void setInactivePeriods(Set<String> inactivePeriods) {
        this.inactivePeriods = normalize(inactivePeriods);
    }

    public double getMinActiveTemperature() {
        return minActiveTemperature;
    }

    public void setMinActiveTemperature(double minActiveTemperature) {
        this.minActiveTemperature = minActiveTemperature;
    }

    public DangerLevel getDangerLevel() {
        return dangerLevel;
    }

    public void setDangerLevel(DangerLevel dangerLevel) {
        this.dangerLevel = dangerLevel != null ? dangerLevel : DangerLevel.NONE;
    }

    public boolean isRare() {
        return rare;
    }

    public void setRare(boolean rare) {
        this.rare = rare;
    }

    @Override
    public String toString() {
        return "SpeciesProfile{" +
                "name='" + name + '\'' +
                ", size=[" + minSize + ", " + maxSize + "]" +
                ", active=" + activePeriods +
                ", inactive=" + inactivePeriods +
                ", dangerLevel=" + dangerLevel +
                ", rare=" + rare +
                '}';
    }
}
