package net.scoreworks.datamodel.parameters;

import net.scoreworks.datamodel.ModelScope;
import net.scoreworks.datamodel.ModelSettings;
import net.scoreworks.datamodel.NotificationQueue;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public class ParameterSetTests {
    ModelScope scope;
    Config config;
    ParameterSet parameterSet;
    Parameter parameter;

    @BeforeEach
    public void prepareParameterSet() {
        scope = new ModelScope(new ModelSettings(), new NotificationQueue());
        config = Config.create(scope);
        parameterSet = ParameterSet.create(scope, "P1");
        parameterSet.setBaseID("base");
        parameterSet.setModuleID("scautopick");
        parameterSet.setCreated(Instant.parse("2023-01-01T00:00:00Z"));
        parameter = Parameter.create(scope, "C1");
        parameter.setName("detecStream");
        parameter.setValue("BHZ");
    }

    @Test
    public void testAddAndRemoveKeepsRegistration() {
        Assertions.assertTrue(parameterSet.add(parameter));
        Assertions.assertEquals(1, parameterSet.parameterCount());
        Assertions.assertSame(parameterSet, parameter.getParent());
        Assertions.assertSame(parameterSet, parameter.parameterSet());
        Assertions.assertSame(parameter, scope.findByIdentifier("C1"));

        ParameterSet other = ParameterSet.create(scope, "P2");
        Assertions.assertFalse(other.add(parameter));
        Assertions.assertEquals(1, parameterSet.parameterCount());
        Assertions.assertEquals(0, other.parameterCount());

        Assertions.assertTrue(parameterSet.remove(parameter));
        Assertions.assertNull(parameter.getParent());
        Assertions.assertEquals(0, parameterSet.parameterCount());
        //detaching is not destruction
        Assertions.assertSame(parameter, scope.findByIdentifier("C1"));
    }

    @Test
    public void testCloneHasEmptyAggregations() {
        parameterSet.add(parameter);
        parameterSet.add(new Comment("c", "checked"));
        ParameterSet clone = parameterSet.clone();
        Assertions.assertEquals(0, clone.parameterCount());
        Assertions.assertEquals(0, clone.commentCount());
        Assertions.assertEquals(1, parameterSet.parameterCount());
        Assertions.assertEquals(parameterSet, clone);
        Assertions.assertEquals(parameterSet.hashCode(), clone.hashCode());
        Assertions.assertNotSame(parameterSet, clone);
        Assertions.assertNull(clone.getParent());
        Assertions.assertFalse(clone.isRegistered());
        Assertions.assertSame(parameterSet, scope.findByIdentifier("P1"));
    }

    @Test
    public void testEqualityIgnoresChildren() {
        ParameterSet other = parameterSet.clone();
        other.add(Parameter.create(scope, "C2"));
        Assertions.assertEquals(parameterSet, other);

        other.setModuleID("scamp");
        Assertions.assertNotEquals(parameterSet, other);
        Assertions.assertNotEquals(parameterSet, parameter);
        Assertions.assertNotEquals(parameterSet, null);
    }

    @Test
    public void testAssignCopiesScalarsOnly() {
        ParameterSet target = ParameterSet.create(scope, "P2");
        target.add(Parameter.create(scope, "C2"));
        parameterSet.add(parameter);

        Assertions.assertTrue(target.assign(parameterSet));
        Assertions.assertEquals("base", target.getBaseID());
        Assertions.assertEquals("scautopick", target.getModuleID());
        Assertions.assertEquals(parameterSet.getCreated(), target.getCreated());
        Assertions.assertEquals(1, target.parameterCount());
        Assertions.assertEquals("C2", target.parameter(0).getPublicId());
        //identifiers differ, so the objects still differ
        Assertions.assertNotEquals(parameterSet, target);
    }

    @Test
    public void testAssignAcrossTypesFails() {
        Assertions.assertFalse(parameterSet.assign(parameter));
        Assertions.assertFalse(parameterSet.assign(null));
        Assertions.assertFalse(parameter.assign(new Comment("c", "text")));
        Assertions.assertEquals("scautopick", parameterSet.getModuleID());
    }

    @Test
    public void testCloneAddAssignRoundTrip() {
        Parameter second = Parameter.create(scope, "C2");
        parameterSet.add(parameter);
        parameterSet.add(second);
        parameterSet.add(new Comment("c", "checked"));

        ParameterSet copy = parameterSet.clone();
        for (Parameter p : new ArrayList<>(List.of(parameter, second))) {
            Assertions.assertTrue(parameterSet.remove(p));
            Assertions.assertTrue(copy.add(p));
        }
        copy.add(parameterSet.comment(0).clone());
        Assertions.assertTrue(copy.assign(parameterSet));

        Assertions.assertEquals(parameterSet, copy);
        Assertions.assertEquals(2, copy.parameterCount());
        Assertions.assertSame(parameter, copy.findParameter("C1"));
        Assertions.assertSame(second, copy.findParameter("C2"));
        Assertions.assertEquals(parameterSet.comment(0), copy.comment(new CommentIndex("c")));
    }

    @Test
    public void testCloneOfRegisteredChildCannotBeAdded() {
        ParameterSet other = ParameterSet.create(scope, "P2");
        Parameter clone = parameter.clone();
        Assertions.assertEquals(parameter, clone);
        Assertions.assertFalse(other.add(clone));
        Assertions.assertNull(clone.getParent());
        Assertions.assertEquals(0, other.parameterCount());
    }

    @Test
    public void testAttachAndDetach() {
        Assertions.assertTrue(parameterSet.attachTo(config));
        Assertions.assertSame(config, parameterSet.config());
        Assertions.assertSame(parameterSet, config.findParameterSet("P1"));
        Assertions.assertEquals(1, config.parameterSetCount());

        //already attached
        Assertions.assertFalse(parameterSet.attachTo(config));
        Config otherConfig = Config.create(scope, "Config2");
        Assertions.assertFalse(parameterSet.attachTo(otherConfig));
        Assertions.assertFalse(parameterSet.detachFrom(otherConfig));
        Assertions.assertEquals(1, config.parameterSetCount());

        Assertions.assertTrue(parameterSet.detachFrom(config));
        Assertions.assertNull(parameterSet.getParent());
        Assertions.assertEquals(0, config.parameterSetCount());
        Assertions.assertTrue(parameterSet.isRegistered());
    }

    @Test
    public void testAttachToUnsupportedParentFails() {
        Assertions.assertFalse(parameterSet.attachTo(parameter));
        Assertions.assertFalse(parameterSet.attachTo(null));
        Assertions.assertFalse(config.attachTo(parameterSet));
        Assertions.assertNull(parameterSet.getParent());
        Assertions.assertEquals(0, parameter.commentCount());
    }

    @Test
    public void testAttachChildren() {
        Assertions.assertTrue(parameter.attachTo(parameterSet));
        Comment comment = new Comment("c", "text");
        Assertions.assertTrue(comment.attachTo(parameter));
        Assertions.assertSame(parameter, comment.parameter());
        Assertions.assertNull(comment.parameterSet());
        Assertions.assertTrue(comment.detach());
        Assertions.assertTrue(comment.attachTo(parameterSet));
        Assertions.assertSame(parameterSet, comment.parameterSet());
    }

    @Test
    public void testDetachOfUnattachedObjectFails() {
        Assertions.assertFalse(parameterSet.detach());
        Assertions.assertNull(parameterSet.getParent());
        Assertions.assertTrue(parameterSet.isRegistered());
        Assertions.assertEquals("scautopick", parameterSet.getModuleID());

        parameterSet.attachTo(config);
        Assertions.assertTrue(parameterSet.detach());
        Assertions.assertFalse(parameterSet.detach());
    }

    @Test
    public void testUpdateChildFromDetachedCopy() {
        parameterSet.add(parameter);
        Parameter copy = parameter.clone();
        copy.setValue("HHZ");
        Assertions.assertTrue(parameterSet.updateChild(copy));
        Assertions.assertEquals("HHZ", parameter.getValue());
        Assertions.assertEquals(1, parameterSet.parameterCount());
        Assertions.assertNull(copy.getParent());

        Comment comment = new Comment("c", "first");
        parameterSet.add(comment);
        Assertions.assertTrue(parameterSet.updateChild(new Comment("c", "second")));
        Assertions.assertEquals("second", comment.getText());
    }

    @Test
    public void testUpdateChildOfNonMemberFails() {
        parameterSet.add(parameter);
        Assertions.assertFalse(parameterSet.updateChild(Parameter.create(scope, "C2")));
        Assertions.assertFalse(parameterSet.updateChild(new Comment("c", "text")));
        Assertions.assertFalse(parameterSet.updateChild(config));
        Assertions.assertFalse(parameterSet.updateChild(null));
    }

    @Test
    public void testUpdateRequiresParent() {
        Assertions.assertFalse(parameter.update());
        parameterSet.add(parameter);
        Assertions.assertTrue(parameter.update());
    }

    @Test
    public void testDestroy() {
        parameterSet.attachTo(config);
        parameterSet.add(parameter);
        Comment comment = new Comment("c", "text");
        parameterSet.add(comment);

        parameterSet.destroy();
        Assertions.assertEquals(0, config.parameterSetCount());
        Assertions.assertNull(parameterSet.getParent());
        Assertions.assertFalse(parameterSet.isRegistered());
        Assertions.assertNull(scope.findByIdentifier("P1"));
        Assertions.assertEquals(0, parameterSet.parameterCount());
        Assertions.assertNull(parameter.getParent());
        Assertions.assertNull(comment.getParent());
        //children keep their own registration
        Assertions.assertSame(parameter, scope.findByIdentifier("C1"));
        Assertions.assertNotNull(ParameterSet.create(scope, "P1"));
    }
}
