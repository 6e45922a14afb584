package com.cs15.helpdesk.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VersionTest {

    private String previous;

    @AfterEach
    void restoreProperty() {
        if (previous == null) {
            System.clearProperty(Version.PROPERTY);
        } else {
            System.setProperty(Version.PROPERTY, previous);
        }
    }

    @Test
    void get_uses_system_property_override_in_tests() {
        previous = System.getProperty(Version.PROPERTY);
        System.setProperty(Version.PROPERTY, " 9.9.9-test ");
        assertThat(Version.get()).isEqualTo("9.9.9-test");
        assertThat(Version.find()).contains("9.9.9-test");
    }

    @Test
    void get_returns_surefire_injected_version_when_override_not_changed() {
        // Surefire sets -Dhelpdesk.version=<project.version>
        previous = System.getProperty(Version.PROPERTY);
        assertThat(previous).isNotBlank();
        assertThat(Version.get()).isEqualTo(previous);
    }
}
