package com.cs15.helpdesk.utils.config;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON parsing for {@link UiSettings}.
 * Reads the tree model so absent keys fall back to the built-in defaults one by one.
 */
public final class UiSettingsJson {

    /** Classpath location of the bundled settings. */
    public static final String RESOURCE = "/helpdesk-ui.json";

    static final ObjectMapper MAPPER = new ObjectMapper();

    private UiSettingsJson() { }

    /**
     * Loads the bundled settings resource.
     *
     * <p>A missing resource yields {@link UiSettings#defaults()}.</p>
     *
     * @return parsed settings
     * @throws UiSettings.UiSettingsException when the resource is unreadable or invalid
     */
    public static UiSettings loadBundled() {
        try (InputStream in = UiSettingsJson.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                return UiSettings.defaults();
            }
            return fromTree(MAPPER.readTree(in));
        } catch (IOException e) {
            throw new UiSettings.UiSettingsException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * Parses settings from a JSON string.
     *
     * @param json JSON text
     * @return parsed settings
     * @throws UiSettings.UiSettingsException on malformed JSON or out-of-range values
     */
    public static UiSettings parse(String json) {
        try {
            return fromTree(MAPPER.readTree(json == null ? "" : json));
        } catch (JsonProcessingException e) {
            throw new UiSettings.UiSettingsException("Invalid settings JSON", e);
        }
    }

    private static UiSettings fromTree(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return UiSettings.defaults();
        }
        if (!root.isObject()) {
            throw new UiSettings.UiSettingsException("Settings JSON must be an object");
        }
        return new UiSettings(parseWindow(root.path("window")), parseSidebar(root.path("sidebar")));
    }

    private static UiSettings.Window parseWindow(JsonNode node) {
        UiSettings.Window d = UiSettings.defaultWindow();
        JsonNode title = node.path("title");
        return new UiSettings.Window(
                title.isTextual() ? title.asText() : d.title(),
                intOr(node, "x", d.x()),
                intOr(node, "y", d.y()),
                intOr(node, "width", d.width()),
                intOr(node, "height", d.height())
        );
    }

    private static UiSettings.SidebarGeometry parseSidebar(JsonNode node) {
        UiSettings.SidebarGeometry d = UiSettings.defaultSidebar();
        return new UiSettings.SidebarGeometry(
                intOr(node, "expandedWidth", d.expandedWidth()),
                intOr(node, "collapsedWidth", d.collapsedWidth()),
                intOr(node, "animationMillis", d.animationMillis())
        );
    }

    private static int intOr(JsonNode parent, String key, int fallback) {
        JsonNode n = parent.path(key);
        if (n.isMissingNode() || n.isNull()) {
            return fallback;
        }
        if (!n.canConvertToInt() || !n.isIntegralNumber()) {
            throw new UiSettings.UiSettingsException("Expected an integer for '" + key + "' but got: " + n);
        }
        return n.intValue();
    }
}
