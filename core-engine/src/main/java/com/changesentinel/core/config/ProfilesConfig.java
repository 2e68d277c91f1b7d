package com.changesentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The set of named detection profiles a run applies to one series, bound
 * from a {@code profiles:} list:
 *
 * <pre>
 * profiles:
 *   - name: level_shift
 *     method: cusum
 *     thresholdSource: montecarlo
 *     alpha: 0.05
 *   - name: segments
 *     method: pelt
 *     family: meanvar
 *     penaltyCriterion: bic
 * </pre>
 *
 * <p>
 * Profile names key the entries of the run report, so they must be unique.
 * </p>
 *
 * @since 1.0.0
 */
public class ProfilesConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<DetectionProfile> profiles = new ArrayList<>();

    /**
     * @return unmodifiable list of detection profiles
     */
    public List<DetectionProfile> getProfiles() {
        return Collections.unmodifiableList(profiles);
    }

    /** Bean setter SnakeYAML binds {@code profiles:} to. */
    public void setProfiles(List<DetectionProfile> profiles) {
        this.profiles = profiles != null ? new ArrayList<>(profiles) : new ArrayList<>();
    }

    /**
     * Check every profile and the name uniqueness in one pass, reporting each
     * bad profile and each repeated name together.
     *
     * @throws IllegalStateException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < profiles.size(); i++) {
            DetectionProfile profile = Objects.requireNonNull(profiles.get(i),
                    "Profile at index " + i + " is null");
            try {
                profile.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (profile.getName() != null && !names.add(profile.getName())) {
                errors.add("Duplicate profile name: '" + profile.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Profiles configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "ProfilesConfig{profiles=" + profiles + '}';
    }
}
