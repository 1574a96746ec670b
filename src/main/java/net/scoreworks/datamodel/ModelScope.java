/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.datamodel;

import org.apache.commons.lang3.Validate;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A document or session the data model lives in. Each scope has its own {@link PublicObjectRegistry}, identifier
 * generator and {@link Notifier}, so independent documents never see each other's identifiers. Objects are bound
 * to the scope they are created in.
 * <p>
 * Structural changes within a scope must be serialized by the caller: only the registry itself is thread-safe.
 */
public class ModelScope {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModelScope.class);

    private final PublicObjectRegistry registry = new PublicObjectRegistry();
    private final PublicIdGenerator idGenerator;
    private Notifier notifier;
    private boolean registrationEnabled;
    private boolean notificationsEnabled;

    /**
     * Create a scope with the settings of the classpath and a {@link NotificationQueue}
     */
    public ModelScope() {
        this(ModelSettings.load(), new NotificationQueue());
    }

    public ModelScope(ModelSettings settings, Notifier notifier) {
        this.idGenerator = new PublicIdGenerator(settings.getPublicIdPattern());
        this.notifier = Validate.notNull(notifier, "notifier");
        this.registrationEnabled = settings.isRegistrationEnabled();
        this.notificationsEnabled = settings.isNotificationsEnabled();
    }

    public PublicObjectRegistry getRegistry() {
        return registry;
    }

    @Nullable
    public PublicObject findByIdentifier(String publicId) {
        return registry.find(publicId);
    }

    @Nullable
    public <P extends PublicObject> P findByIdentifier(String publicId, Class<P> type) {
        return registry.find(publicId, type);
    }

    public String generatePublicId(Class<? extends PublicObject> clazz) {
        return idGenerator.generate(clazz);
    }

    /**
     * If disabled, factories and aggregations no longer register objects. Explicit calls to
     * {@link Registrable#register()} still do
     */
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

    public Notifier getNotifier() {
        return notifier;
    }

    public void setNotifier(Notifier notifier) {
        this.notifier = Validate.notNull(notifier, "notifier");
    }

    /**
     * Forward notification to the notifier if notifications are enabled. Failures of the notifier are logged only
     */
    void publish(Notification notification) {
        if (!notificationsEnabled)
            return;
        try {
            notifier.publish(notification);
        } catch (RuntimeException e) {
            LOGGER.warn("Notifier failed to publish {}", notification, e);
        }
    }

    /**
     * Publish a notification for object and each of its descendants. Additions are published parents first,
     * removals children first
     */
    void publishTree(Notification.Operation operation, ModelObject object) {
        if (!notificationsEnabled)
            return;
        object.accept(new NotificationCreator(operation));
    }


    private class NotificationCreator implements Visitor {
        private final Notification.Operation operation;

        NotificationCreator(Notification.Operation operation) {
            this.operation = operation;
        }

        @Override
        public TraversalMode getTraversal() {
            return operation == Notification.Operation.REMOVE ? TraversalMode.BOTTOM_UP : TraversalMode.TOP_DOWN;
        }

        @Override
        public boolean visit(PublicObject object) {
            create(object);
            return true;
        }

        @Override
        public void visit(ModelObject object) {
            create(object);
        }

        private void create(ModelObject object) {
            PublicObject parent = object.getParent();
            if (parent != null)
                publish(new Notification(operation, parent, object));
        }
    }
}
