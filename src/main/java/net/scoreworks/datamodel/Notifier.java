/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel;

/**
 * Receives the {@link Notification}s of a {@link ModelScope}, e.g. to forward them to persistence or messaging.
 * Publishing is fire-and-forget: an exception thrown here is logged and never rolls back the change it reports.
 */
@FunctionalInterface
public interface Notifier {

    void publish(Notification notification);
}
