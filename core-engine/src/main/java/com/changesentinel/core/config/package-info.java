/**
 * YAML-driven configuration of detection profiles.
 *
 * <p>
 * {@link com.changesentinel.core.config.ProfilesLoader} parses a
 * {@code profiles:} list with SnakeYAML into
 * {@link com.changesentinel.core.config.DetectionProfile} POJOs and validates
 * them before any detector is built.
 * </p>
 *
 * @since 1.0.0
 */
package com.changesentinel.core.config;
