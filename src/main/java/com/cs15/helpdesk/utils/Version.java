package com.cs15.helpdesk.utils;

import java.util.Optional;

/**
 * Centralized version accessor.
 * Production: reads Implementation-Version from the JAR manifest.
 * Tests: Surefire sets -Dhelpdesk.version=<value> to run without a JAR.
 */
public final class Version {

    static final String PROPERTY = "helpdesk.version";

    private Version() {}

    /**
     * Returns the application version, failing when none is available.
     *
     * @return non-blank version string
     * @throws IllegalStateException when neither the override nor the manifest provides a version
     */
    public static String get() {
        return find().orElseThrow(() -> new IllegalStateException(
                "Implementation-Version not found in manifest. " +
                        "Set -D" + PROPERTY + " for tests or run from the packaged JAR."
        ));
    }

    /**
     * Looks up the version without failing; used where a missing version is cosmetic.
     *
     * @return the version, or empty when running from unpackaged classes
     */
    public static Optional<String> find() {
        String override = System.getProperty(PROPERTY);
        if (override != null && !override.isBlank()) {
            return Optional.of(override.trim());
        }
        Package p = Version.class.getPackage();
        String mv = (p != null) ? p.getImplementationVersion() : null;
        if (mv == null || mv.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(mv);
    }
}
