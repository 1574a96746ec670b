package net.scoreworks.datamodel;

import net.scoreworks.datamodel.parameters.Parameter;
import net.scoreworks.datamodel.parameters.ParameterSet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Properties;

public class PublicIdGeneratorTests {
    Clock clock = Clock.fixed(Instant.parse("2023-05-04T10:15:30.123456Z"), ZoneOffset.UTC);

    @Test
    public void testDefaultPattern() {
        PublicIdGenerator generator = new PublicIdGenerator(ModelSettings.DEFAULT_PUBLIC_ID_PATTERN, clock);
        Assertions.assertEquals("ParameterSet#20230504101530.123456.0", generator.generate(ParameterSet.class));
        Assertions.assertEquals("Parameter#20230504101530.123456.1", generator.generate(Parameter.class));
    }

    @Test
    public void testCustomPattern() {
        PublicIdGenerator generator = new PublicIdGenerator("smi:org/@classname@/@id@", clock);
        Assertions.assertEquals("smi:org/Parameter/0", generator.generate(Parameter.class));
    }

    @Test
    public void testFactoryGeneratesUniqueIdentifiers() {
        ModelScope scope = new ModelScope(new ModelSettings(), new NotificationQueue());
        ParameterSet first = ParameterSet.create(scope);
        ParameterSet second = ParameterSet.create(scope);
        Assertions.assertTrue(first.getPublicId().startsWith("ParameterSet#"));
        Assertions.assertNotEquals(first.getPublicId(), second.getPublicId());
        Assertions.assertSame(second, scope.findByIdentifier(second.getPublicId()));
    }

    @Test
    public void testSettingsFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(ModelSettings.REGISTRATION_ENABLED, "false");
        properties.setProperty(ModelSettings.NOTIFICATIONS_ENABLED, " no ");
        properties.setProperty(ModelSettings.PUBLIC_ID_PATTERN, "@classname@-@id@");
        ModelSettings settings = ModelSettings.fromProperties(properties);
        Assertions.assertFalse(settings.isRegistrationEnabled());
        Assertions.assertFalse(settings.isNotificationsEnabled());

        ModelScope scope = new ModelScope(settings, new NotificationQueue());
        Assertions.assertFalse(scope.isRegistrationEnabled());
        Assertions.assertEquals("Parameter-0", scope.generatePublicId(Parameter.class));
    }

    @Test
    public void testSettingsFromClasspath() {
        ModelSettings settings = ModelSettings.load();
        Assertions.assertTrue(settings.isRegistrationEnabled());
        Assertions.assertTrue(settings.isNotificationsEnabled());
        Assertions.assertEquals(ModelSettings.DEFAULT_PUBLIC_ID_PATTERN, settings.getPublicIdPattern());
        Assertions.assertEquals(ModelSettings.DEFAULT_PUBLIC_ID_PATTERN, ModelSettings.fromProperties(new Properties()).getPublicIdPattern());

        ModelScope scope = new ModelScope();
        Assertions.assertTrue(scope.isNotificationsEnabled());
        Assertions.assertTrue(scope.getNotifier() instanceof NotificationQueue);
    }
}
