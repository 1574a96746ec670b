/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel;

import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;


/**
 * Settings a {@link ModelScope} is created with. Defaults can be overridden programmatically or by a
 * {@value #RESOURCE} file on the classpath.
 */
public class ModelSettings {
    public static final String RESOURCE = "datamodel.properties";
    public static final String REGISTRATION_ENABLED = "datamodel.registration.enabled";
    public static final String NOTIFICATIONS_ENABLED = "datamodel.notifications.enabled";
    public static final String PUBLIC_ID_PATTERN = "datamodel.publicId.pattern";
    public static final String DEFAULT_PUBLIC_ID_PATTERN = "@classname@#@time@.@id@";

    private boolean registrationEnabled = true;
    private boolean notificationsEnabled = true;
    private String publicIdPattern = DEFAULT_PUBLIC_ID_PATTERN;

    /**
     * @return settings read from {@value #RESOURCE}, or the defaults if there is no such resource
     */
    public static ModelSettings load() {
        Properties properties = new Properties();
        try (InputStream in = ModelSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null)
                properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + RESOURCE, e);
        }
        return fromProperties(properties);
    }

    /**
     * Missing keys keep their default value
     */
    public static ModelSettings fromProperties(Properties properties) {
        ModelSettings settings = new ModelSettings();
        String registration = properties.getProperty(REGISTRATION_ENABLED);
        if (StringUtils.isNotBlank(registration))
            settings.registrationEnabled = BooleanUtils.toBoolean(registration.trim());
        String notifications = properties.getProperty(NOTIFICATIONS_ENABLED);
        if (StringUtils.isNotBlank(notifications))
            settings.notificationsEnabled = BooleanUtils.toBoolean(notifications.trim());
        settings.publicIdPattern = StringUtils.defaultIfBlank(properties.getProperty(PUBLIC_ID_PATTERN), DEFAULT_PUBLIC_ID_PATTERN).trim();
        return settings;
    }

    public boolean isRegistrationEnabled() {
        return registrationEnabled;
    }

    public void setRegistrationEnabled(boolean registrationEnabled) {
        this.registrationEnabled = registrationEnabled;
    }

    public boolean isNotificationsEnabled() {
        return notificationsEnabled;
    }

    public void setNotificationsEnabled(boolean notificationsEnabled) {
        this.notificationsEnabled = notificationsEnabled;
    }

    public String getPublicIdPattern() {
        return publicIdPattern;
    }

    public void setPublicIdPattern(String publicIdPattern) {
        this.publicIdPattern = publicIdPattern;
    }
}
