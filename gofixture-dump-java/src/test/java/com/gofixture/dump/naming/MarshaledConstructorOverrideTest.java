package com.gofixture.dump.naming;

import com.gofixture.dump.fixtures.Person;
import com.gofixture.dump.fixtures.resource.Quantity;
import com.gofixture.dump.value.Values;
import com.google.gson.Gson;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarshaledConstructorOverrideTest {

    private final TypeNamer namer = new TypeNamer(List.of(new VersionedPackageRule()));
    private final MarshaledConstructorOverride quantity = MarshaledConstructorOverride.quantity();

    @Test
    void rendersConstructorCallAndRecordsImport() {
        DependencySet deps = new DependencySet();
        assertEquals("resource.MustParse(\"250Mi\")", quantity.render(Values.of(Quantity.parse("250Mi")), namer, deps));
        assertTrue(deps.contains(MarshaledConstructorOverride.QUANTITY_PACKAGE));
    }

    @Test
    void otherTypesAreNotHandled() {
        assertNull(quantity.render(Values.of(new Person("p", 1)), namer, new DependencySet()));
        assertNull(quantity.render(Values.of("500m"), namer, new DependencySet()));
    }

    record Version(String major, String minor) {}

    @Test
    void nonPrimitiveMarshalingIsNotHandled() {
        MarshaledConstructorOverride version =
                new MarshaledConstructorOverride("com/gofixture/dump/naming", "Version", "Parse", new Gson());
        assertNull(version.render(Values.of(new Version("1", "2")), namer, new DependencySet()));
    }
}
