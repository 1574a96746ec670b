/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;


/**
 * {@link Notifier} that buffers notifications so they can be consumed later, possibly by another thread.
 * Publishing never calls back into consumer code while the data model is being restructured.
 */
public class NotificationQueue implements Notifier {
    private final Queue<Notification> notifications = new ConcurrentLinkedQueue<>();

    @Override
    public void publish(Notification notification) {
        notifications.add(notification);
    }

    /**
     * @return the oldest pending notification, or null
     */
    @Nullable
    public Notification poll() {
        return notifications.poll();
    }

    /**
     * Removes and returns all pending notifications in publishing order
     */
    public List<Notification> drain() {
        List<Notification> drained = new ArrayList<>();
        Notification notification;
        while ((notification = notifications.poll()) != null) {
            drained.add(notification);
        }
        return drained;
    }

    public int size() {
        return notifications.size();
    }

    public boolean isEmpty() {
        return notifications.isEmpty();
    }

    public void clear() {
        notifications.clear();
    }
}
