package com.cs15.helpdesk.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VersionStrictnessTest {

    private String previous;

    @BeforeEach
    void stash() {
        previous = System.getProperty(Version.PROPERTY);
    }

    @AfterEach
    void restore() {
        if (previous == null) {
            System.clearProperty(Version.PROPERTY);
        } else {
            System.setProperty(Version.PROPERTY, previous);
        }
    }

    @Test
    void get_throws_when_override_is_blank() {
        System.setProperty(Version.PROPERTY, "");
        assertThatThrownBy(Version::get)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Implementation-Version not found");
    }

    @Test
    void find_is_empty_when_override_is_cleared() {
        System.clearProperty(Version.PROPERTY);
        assertThat(Version.find()).isEmpty();
        assertThatThrownBy(Version::get)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("-Dhelpdesk.version");
    }
}
