package com.gofixture.dump.naming;

import com.gofixture.dump.value.GoType;
import com.gofixture.dump.value.Shape;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TypeNamerTest {

    private static final GoType DEPLOYMENT = GoType.named("k8s.io/api/apps/v1", "v1", "Deployment", Shape.STRUCT);
    private static final GoType QUANTITY =
            GoType.named("k8s.io/apimachinery/pkg/api/resource", "resource", "Quantity", Shape.STRUCT);

    private final TypeNamer namer = new TypeNamer(List.of(new VersionedPackageRule()));

    @Test
    void builtinsNeedNoImport() {
        DependencySet deps = new DependencySet();
        assertEquals("int32", namer.name(GoType.INT32, deps));
        assertEquals("interface{}", namer.name(GoType.INTERFACE, deps));
        assertEquals("func()", namer.name(GoType.FUNC, deps));
        assertTrue(deps.isEmpty());
    }

    @Test
    void compositeTypesRecordEveryNamedPart() {
        DependencySet deps = new DependencySet();
        GoType type = GoType.mapOf(GoType.STRING, GoType.sliceOf(GoType.pointerTo(DEPLOYMENT)));
        assertEquals("map[string][]*appsv1.Deployment", namer.name(type, deps));
        assertEquals(Map.of("k8s.io/api/apps/v1", "appsv1"), deps.asMap());
    }

    @Test
    void chanOfNamedType() {
        DependencySet deps = new DependencySet();
        assertEquals("chan resource.Quantity", namer.name(GoType.chanOf(QUANTITY), deps));
        assertEquals("", deps.alias("k8s.io/apimachinery/pkg/api/resource"));
    }

    @Test
    void typeWithoutPackageIsUnqualified() {
        DependencySet deps = new DependencySet();
        assertEquals("Local", namer.name(GoType.named("", "", "Local", Shape.STRUCT), deps));
        assertTrue(deps.isEmpty());
    }

    @Test
    void firstMatchingRuleWins() {
        TypeNamer custom = new TypeNamer(List.of(
                (path, name) -> path.startsWith("k8s.io/api/") ? "k8s" + name : null,
                new VersionedPackageRule()));
        DependencySet deps = new DependencySet();
        assertEquals("k8sv1.Deployment", custom.name(DEPLOYMENT, deps));
        assertEquals("k8sv1", deps.alias("k8s.io/api/apps/v1"));
    }
}
