package com.wildsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the engine YAML configuration.
 *
 * <p>
 * Expected YAML structure (every section is optional and falls back to its
 * defaults):
 * </p>
 *
 * <pre>
 * scoring:
 *   baseWeight: 0.4
 *   temporalWeight: 0.25
 * classification:
 *   defaultFalsePositiveThreshold: 0.6
 * correlation:
 *   correlationWindowSeconds: 600
 * notification:
 *   maxAlertsPerHour: 50
 * species:
 *   - name: wolf
 *     dangerLevel: DANGEROUS
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading; {@link EngineConfigLoader} does so
 * automatically.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private ScoringSettings scoring = new ScoringSettings();
    private AnomalySettings anomaly = new AnomalySettings();
    private ClassificationSettings classification = new ClassificationSettings();
    private CorrelationSettings correlation = new CorrelationSettings();
    private NotificationSettings notification = new NotificationSettings();
    private AdaptationSettings adaptation = new AdaptationSettings();
    private RuleDefaults ruleDefaults = new RuleDefaults();
    private List<SpeciesProfile> species = new ArrayList<>();

    /**
     * Validate every section of this configuration.
     *
     * <p>
     * Collects all errors and throws a single exception if any section is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        scoring.validate(errors);
        anomaly.validate(errors);
        classification.validate(errors);
        correlation.validate(errors);
        notification.validate(errors);
        adaptation.validate(errors);
        ruleDefaults.validate(errors);

        Set<String> seen = new HashSet<>();
        for (int i = 0; i < species.size(); i++) {
            SpeciesProfile profile = Objects.requireNonNull(species.get(i),
                    "Species profile at index " + i + " is null");
            profile.validate(errors);
            if (profile.getName() != null && !seen.add(profile.getName())) {
                errors.add("Duplicate species profile: '" + profile.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration has " + errors.size() + " error(s): "
                            + String.join("; ", errors));
        }
    }

    /**
     * @return a lookup over the configured species profiles
     */
    public SpeciesCatalog speciesCatalog() {
        return new SpeciesCatalog(species);
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public ScoringSettings getScoring() {
        return scoring;
    }

    public void setScoring(ScoringSettings scoring) {
        this.scoring = scoring != null ? scoring : new ScoringSettings();
    }

    public AnomalySettings getAnomaly() {
        return anomaly;
    }

    public void setAnomaly(AnomalySettings anomaly) {
        this.anomaly = anomaly != null ? anomaly : new AnomalySettings();
    }

    public ClassificationSettings getClassification() {
        return classification;
    }

    public void setClassification(ClassificationSettings classification) {
        this.classification = classification != null ? classification : new ClassificationSettings();
    }

    public CorrelationSettings getCorrelation() {
        return correlation;
    }

    public void setCorrelation(CorrelationSettings correlation) {
        this.correlation = correlation != null ? correlation : new CorrelationSettings();
    }

    public NotificationSettings getNotification() {
        return notification;
    }

    public void setNotification(NotificationSettings notification) {
        this.notification = notification != null ? notification : new NotificationSettings();
    }

    public AdaptationSettings getAdaptation() {
        return adaptation;
    }

    public void setAdaptation(AdaptationSettings adaptation) {
        this.adaptation = adaptation != null ? adaptation : new AdaptationSettings();
    }

    public RuleDefaults getRuleDefaults() {
        return ruleDefaults;
    }

    public void setRuleDefaults(RuleDefaults ruleDefaults) {
        this.ruleDefaults = ruleDefaults != null ? ruleDefaults : new RuleDefaults();
    }

    /**
     * @return unmodifiable list of species profiles
     */
    public List<SpeciesProfile> getSpecies() {
        return Collections.unmodifiableList(species);
    }

    public void setSpecies(List<SpeciesProfile> species) {
        this.species = species != null ? new ArrayList<>(species) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "EngineConfig{species=" + species.size()
                + ", correlationWindowSeconds=" + correlation.getCorrelationWindowSeconds()
                + ", maxAlertsPerHour=" + notification.getMaxAlertsPerHour()
                + '}';
    }
}
