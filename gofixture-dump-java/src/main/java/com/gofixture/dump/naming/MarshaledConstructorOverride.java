package com.gofixture.dump.naming;

import com.gofixture.dump.GoSyntax;
import com.gofixture.dump.value.GoType;
import com.gofixture.dump.value.Shape;
import com.gofixture.dump.value.Value;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;

/**
 * Renders a struct type through a parsing constructor fed with the value's JSON string form,
 * e.g. {@code resource.MustParse("500m")} for a Kubernetes quantity.
 *
 * The value's object is serialized with Gson; the override applies only when that yields a
 * JSON primitive, which is the case for types carrying a string {@code @JsonAdapter}.
 */
public final class MarshaledConstructorOverride implements LiteralOverride {

    public static final String QUANTITY_PACKAGE = "k8s.io/apimachinery/pkg/api/resource";

    private final String pkgPath;
    private final String typeName;
    private final String constructor;
    private final Gson gson;

    public MarshaledConstructorOverride(String pkgPath, String typeName, String constructor, Gson gson) {
        this.pkgPath = pkgPath;
        this.typeName = typeName;
        this.constructor = constructor;
        this.gson = gson;
    }

    /** {@code resource.Quantity} values as {@code resource.MustParse("...")}. */
    public static MarshaledConstructorOverride quantity() {
        return new MarshaledConstructorOverride(QUANTITY_PACKAGE, "Quantity", "MustParse",
                new GsonBuilder().disableHtmlEscaping().create());
    }

    @Override
    public String render(Value value, TypeNamer namer, DependencySet dependencies) {
        GoType type = value.type();
        if (value.shape() != Shape.STRUCT || !type.isNamed()
                || !typeName.equals(type.name()) || !pkgPath.equals(type.pkgPath())) {
            return null;
        }
        Object target = value.unwrap();
        if (target == null) {
            return null;
        }
        String text;
        try {
            JsonElement json = gson.toJsonTree(target);
            if (!json.isJsonPrimitive()) {
                return null;
            }
            text = json.getAsString();
        } catch (RuntimeException e) {
            System.err.println("[gofixture] WARNING: could not marshal " + type.qualifiedName() + ": " + e.getMessage());
            return null;
        }
        return namer.qualify(pkgPath, type.pkgName(), dependencies) + "." + constructor + "(" + GoSyntax.quote(text) + ")";
    }
}
