package com.gofixture.dump;

import com.gofixture.dump.fixtures.Person;
import com.gofixture.dump.fixtures.apps.Container;
import com.gofixture.dump.fixtures.apps.Deployment;
import com.gofixture.dump.fixtures.meta.ObjectMeta;
import com.gofixture.dump.fixtures.resource.Quantity;
import com.google.gson.JsonNull;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FixtureDumperTest {

    private final FixtureDumper dumper = new FixtureDumper(DumpConfig.defaults().withIndent("  "));

    @Test
    void zeroStructWithImport() {
        DumpResult result = dumper.dump(new Person());
        assertEquals("""
                import (
                \t"com/gofixture/dump/fixtures"
                )

                var _ = &fixtures.Person{
                }
                """, result.text());
        assertEquals(Map.of("com/gofixture/dump/fixtures", ""), result.dependencies());
    }

    @Test
    void builtinOnlyLiteralHasNoImportBlock() {
        assertEquals("var _ = []byte(`ab`)\n", dumper.sdump((Object) new byte[] {'a', 'b'}));
    }

    @Test
    void nullsAreSkipped() {
        assertEquals("var _ = \"x\"\n", dumper.sdump(null, "x", JsonNull.INSTANCE));
        assertEquals("", dumper.sdump((Object) null));
    }

    @Test
    void packageHeaderAndSeveralLiterals() {
        FixtureDumper withPackage = new FixtureDumper(DumpConfig.defaults().withPackageName("testdata"));
        assertEquals("""
                package testdata

                var _ = 1
                var _ = true
                """, withPackage.sdump(1, true));
    }

    @Test
    void deploymentUsesVersionedAliasesAndQuantityConstructor() {
        Deployment d = new Deployment();
        d.metadata = ObjectMeta.named("web");
        d.replicas = 3;
        d.containers = List.of(new Container("app", Map.of("cpu", Quantity.parse("500m"))));

        DumpResult result = dumper.dump(d);
        assertEquals("""
                import (
                \tappsv1 "k8s.io/api/apps/v1"
                \t"k8s.io/apimachinery/pkg/api/resource"
                \tmetav1 "k8s.io/apimachinery/pkg/apis/meta/v1"
                )

                var _ = &appsv1.Deployment{
                  Metadata: metav1.ObjectMeta{
                    Name: "web",
                  },
                  Replicas: func(x int32) *int32 {return &x }(3),
                  Containers: []appsv1.Container{
                    appsv1.Container{
                      Name: "app",
                      Limits: map[string]resource.Quantity{
                        "cpu": resource.MustParse("500m"),
                      },
                    },
                  },
                }
                """, result.text());
        assertEquals(List.of("k8s.io/api/apps/v1", "k8s.io/apimachinery/pkg/api/resource",
                "k8s.io/apimachinery/pkg/apis/meta/v1"), List.copyOf(result.dependencies().keySet()));
    }

    @Test
    void importsAreMergedAcrossLiterals() {
        DumpResult result = dumper.dump(new Person(), Quantity.parse("1Gi"), Double.NaN);
        assertEquals(List.of("com/gofixture/dump/fixtures", "k8s.io/apimachinery/pkg/api/resource", "math"),
                List.copyOf(result.dependencies().keySet()));
        assertTrue(result.text().endsWith("""
                var _ = &fixtures.Person{
                }
                var _ = resource.MustParse("1Gi")
                var _ = math.NaN()
                """));
    }

    @Test
    void jsonDocumentIsDumpedAsInterfaceTree() {
        assertEquals("""
                var _ = map[string]interface{}{
                  "n": 2.5,
                }
                """, dumper.sdump(JsonParser.parseString("{\"n\": 2.5}")));
    }

    @Test
    void customRulesReplaceDefaults() {
        FixtureDumper plain = new FixtureDumper(DumpConfig.defaults(), List.of(), List.of());
        String text = plain.sdump(Quantity.parse("2"));
        assertTrue(text.contains("var _ = resource.Quantity{\n\tValue: \"2\",\n}\n"), text);
    }

    @Test
    void fdumpWritesToSink() {
        StringBuilder sink = new StringBuilder();
        dumper.fdump(sink, "a");
        assertEquals("var _ = \"a\"\n", sink.toString());
    }

    @Test
    void fdumpWrapsSinkFailure() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] buf, int off, int len) throws IOException {
                throw new IOException("closed");
            }

            @Override
            public void flush() { }

            @Override
            public void close() { }
        };
        assertThrows(DumpException.class, () -> dumper.fdump(broken, "a"));
    }
}
