/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel;

import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;


/**
 * Generates public identifiers from a pattern. Supported tokens are {@value #CLASSNAME}, replaced by the simple
 * class name, {@value #TIME}, replaced by the current UTC time with microseconds, and {@value #ID}, replaced by a
 * counter that is incremented with each generated identifier.
 */
public class PublicIdGenerator {
    public static final String CLASSNAME = "@classname@";
    public static final String TIME = "@time@";
    public static final String ID = "@id@";

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss.SSSSSS").withZone(ZoneOffset.UTC);

    private final String pattern;
    private final Clock clock;
    private long currentId;

    public PublicIdGenerator(String pattern) {
        this(pattern, Clock.systemUTC());
    }

    public PublicIdGenerator(String pattern, Clock clock) {
        this.pattern = pattern;
        this.clock = clock;
    }

    public synchronized String generate(Class<?> clazz) {
        String id = Long.toString(currentId);
        currentId++;
        return StringUtils.replaceEach(pattern,
                new String[]{CLASSNAME, TIME, ID},
                new String[]{clazz.getSimpleName(), TIME_FORMAT.format(clock.instant()), id});
    }

    public String getPattern() {
        return pattern;
    }
}
