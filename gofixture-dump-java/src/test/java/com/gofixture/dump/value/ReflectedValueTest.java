package com.gofixture.dump.value;

import com.gofixture.dump.annotation.GoName;
import com.gofixture.dump.annotation.GoPackage;
import com.gofixture.dump.fixtures.Person;
import com.gofixture.dump.fixtures.apps.Deployment;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ReflectedValueTest {

    // --- Classification ---

    @Test
    void javaClassIsPointerToStruct() {
        Value v = ReflectedValue.of(new Person("a", 1));
        assertEquals(Shape.POINTER, v.shape());
        assertEquals("*fixtures.Person", v.type().toString());
        Value struct = v.elem();
        assertEquals(Shape.STRUCT, struct.shape());
        assertEquals(2, struct.numFields());
        assertEquals("Name", struct.fieldName(0));
        assertEquals("a", struct.field(0).stringValue());
        assertEquals(1, struct.field(1).intValue());
    }

    @Test
    void packageAnnotationGivesGoImportPath() {
        GoType type = ReflectedValue.of(new Deployment()).elem().type();
        assertEquals("k8s.io/api/apps/v1", type.pkgPath());
        assertEquals("v1", type.pkgName());
        assertEquals("Deployment", type.name());
    }

    @GoPackage(value = "example.com/billing/types", name = "billing")
    @GoName("Invoice")
    static class InvoiceDto {
        @GoName("ID")
        String id = "i-1";
        transient String cache = "skip";
        static String shared = "skip";
    }

    @Test
    void classAndFieldAnnotationsOverrideNames() {
        Value struct = ReflectedValue.of(new InvoiceDto()).elem();
        assertEquals("billing.Invoice", struct.type().qualifiedName());
        assertEquals(1, struct.numFields());
        assertEquals("ID", struct.fieldName(0));
    }

    static class Base {
        String kind = "base";
    }

    static class Derived extends Base {
        String extra = "x";
    }

    @Test
    void superclassFieldsComeFirst() {
        Value struct = ReflectedValue.of(new Derived()).elem();
        assertEquals(2, struct.numFields());
        assertEquals("Kind", struct.fieldName(0));
        assertEquals("Extra", struct.fieldName(1));
    }

    @Test
    void scalarsMapToSizedGoTypes() {
        assertEquals(GoType.INT32, ReflectedValue.of(1).type());
        assertEquals(GoType.INT64, ReflectedValue.of(1L).type());
        assertEquals(GoType.INT16, ReflectedValue.of((short) 1).type());
        assertEquals(GoType.RUNE, ReflectedValue.of('c').type());
        assertEquals(GoType.FLOAT32, ReflectedValue.of(1f).type());
        assertEquals(GoType.STRING, ReflectedValue.of("s").type());
    }

    @Test
    void byteReadsUnsigned() {
        Value v = ReflectedValue.of((byte) -1);
        assertEquals(Shape.UINT, v.shape());
        assertEquals(255, v.uintValue());
    }

    static class Boxed {
        Integer count = 4;
        List<Integer> counts = List.of(1);
    }

    @Test
    void boxedFieldIsPointerButBoxedElementIsScalar() {
        Value struct = ReflectedValue.of(new Boxed()).elem();
        Value count = struct.field(0);
        assertEquals(Shape.POINTER, count.shape());
        assertEquals("*int32", count.type().toString());
        assertEquals(Shape.INT, count.elem().shape());
        Value counts = struct.field(1);
        assertEquals("[]int32", counts.type().toString());
        assertEquals(Shape.INT, counts.index(0).shape());
    }

    // --- Containers ---

    @Test
    void runtimeContainerInfersElementType() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("k", new ArrayList<>(List.of("v")));
        Value v = ReflectedValue.of(m);
        assertEquals(Shape.MAP, v.shape());
        assertEquals("map[string][]interface{}", v.type().toString());
        assertEquals(1, v.entries().size());
        assertEquals("k", v.entries().get(0).key().stringValue());
    }

    @Test
    void mixedRuntimeElementsAreInterfaces() {
        Value v = ReflectedValue.of(Arrays.asList("a", 1, null));
        assertEquals("[]interface{}", v.type().toString());
        assertEquals(Shape.INTERFACE, v.index(0).shape());
        assertEquals(Shape.INT, v.index(1).unpack().shape());
        assertTrue(v.index(2).isNil());
    }

    @Test
    void byteArrayIsZeroCopy() {
        byte[] data = {1, 2};
        Value v = ReflectedValue.of(data);
        assertSame(data, v.bytes());
        assertEquals(2, v.length());
        assertTrue(v.type().elem().isByte());
    }

    @Test
    void atomicReferenceIsPointerToContent() {
        Value v = ReflectedValue.of(new AtomicReference<>("s"));
        assertEquals("*string", v.type().toString());
        assertEquals("s", v.elem().stringValue());
    }

    @Test
    void nullIsNilInterface() {
        Value v = ReflectedValue.of(null);
        assertEquals(Shape.INTERFACE, v.shape());
        assertTrue(v.isNil());
    }

    @Test
    void jdkValueIsOpaque() {
        Value v = ReflectedValue.of(java.time.Duration.ofSeconds(5));
        assertEquals(Shape.OTHER, v.shape());
        assertEquals("PT5S", String.valueOf(v.unwrap()));
    }

    @Test
    void neutralResultsForOtherShapes() {
        Value v = ReflectedValue.of("s");
        assertEquals(0, v.length());
        assertEquals(Shape.INVALID, v.index(0).shape());
        assertTrue(v.entries().isEmpty());
        assertNull(v.address());
    }
}
