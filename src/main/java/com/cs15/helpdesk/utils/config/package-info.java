/**
 * Window and sidebar settings.
 *
 * <p>{@link com.cs15.helpdesk.utils.config.UiSettings} is the typed, validated model;
 * {@link com.cs15.helpdesk.utils.config.UiSettingsJson} reads it from the bundled
 * {@code helpdesk-ui.json}. These classes have no Swing dependencies.</p>
 */
package com.cs15.helpdesk.utils.config;
