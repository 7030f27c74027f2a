package com.gofixture.dump.value;

import com.gofixture.dump.annotation.GoName;
import com.gofixture.dump.annotation.GoPackage;

import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.*;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Maps Java types onto shapes and Go type descriptors.
 *
 * Rules:
 * - primitives map to sized Go scalars (int → int32, char → rune, byte → byte …)
 * - boxed primitives are nullable pointers in a field slot, plain scalars anywhere else
 * - String and enums → string; {@link Complex} → complex128
 * - arrays and Collections → slices; Maps → maps; BlockingQueues → chans; lambdas → funcs
 * - AtomicReference&lt;T&gt; → pointer to T
 * - records → struct values; other application classes → pointers to structs
 * - interface, abstract and Object slots → interface{}; remaining JDK classes → OTHER
 */
final class JavaTypeMapper {

    /** Where a value sits; decides how boxed primitives and abstract types are read. */
    enum Slot { FIELD, ELEMENT, RUNTIME }

    private static final Map<Class<?>, Class<?>> UNBOXED = Map.of(
            Boolean.class, boolean.class,
            Byte.class, byte.class,
            Short.class, short.class,
            Character.class, char.class,
            Integer.class, int.class,
            Long.class, long.class,
            Float.class, float.class,
            Double.class, double.class
    );

    private static final Map<Class<?>, GoType> PRIMITIVES = Map.of(
            boolean.class, GoType.BOOL,
            byte.class, GoType.BYTE,
            short.class, GoType.INT16,
            char.class, GoType.RUNE,
            int.class, GoType.INT32,
            long.class, GoType.INT64,
            float.class, GoType.FLOAT32,
            double.class, GoType.FLOAT64
    );

    private static final Type[] NO_ARGS = new Type[0];

    private JavaTypeMapper() {}

    // -----------------------------------------------------------------------
    // Shapes
    // -----------------------------------------------------------------------

    static Shape classify(Class<?> c, Slot slot) {
        if (c.isPrimitive()) {
            GoType t = PRIMITIVES.get(c);
            return t != null ? t.kind() : Shape.INVALID;
        }
        if (UNBOXED.containsKey(c)) {
            return slot == Slot.FIELD ? Shape.POINTER : PRIMITIVES.get(UNBOXED.get(c)).kind();
        }
        if (c == String.class || isEnum(c)) return Shape.STRING;
        if (c == Complex.class) return Shape.COMPLEX;
        if (c.isSynthetic() || c.isHidden()) return Shape.FUNC;
        if (c.isArray()) return Shape.SLICE;
        if (AtomicReference.class.isAssignableFrom(c)) return Shape.POINTER;
        if (BlockingQueue.class.isAssignableFrom(c)) return Shape.CHAN;
        if (Collection.class.isAssignableFrom(c)) return Shape.SLICE;
        if (Map.class.isAssignableFrom(c)) return Shape.MAP;
        if (c.isRecord()) return Shape.STRUCT;
        if (slot != Slot.RUNTIME
                && (c.isInterface() || Modifier.isAbstract(c.getModifiers()) || c == Object.class)) {
            return Shape.INTERFACE;
        }
        if (isJdk(c)) return Shape.OTHER;
        return Shape.POINTER;
    }

    static boolean isBoxed(Class<?> c) {
        return UNBOXED.containsKey(c);
    }

    static boolean isEnum(Class<?> c) {
        return Enum.class.isAssignableFrom(c) && c != Enum.class;
    }

    static boolean isJdk(Class<?> c) {
        String pkg = c.getPackageName();
        return pkg.startsWith("java.") || pkg.startsWith("javax.") || pkg.startsWith("jdk.")
                || pkg.startsWith("sun.") || pkg.startsWith("com.sun.");
    }

    // -----------------------------------------------------------------------
    // Type arguments
    // -----------------------------------------------------------------------

    /**
     * Element (and key) types of a container. Declared type arguments win; a raw container
     * seen at runtime gets its arguments inferred from its content; anything else is Object.
     */
    static Type[] typeArguments(Type declared, Class<?> raw, Shape shape, Slot slot, Object instance) {
        int arity = arity(raw, shape);
        if (arity == 0) {
            return NO_ARGS;
        }
        if (raw.isArray()) {
            return new Type[]{declared instanceof GenericArrayType g
                    ? g.getGenericComponentType()
                    : raw.getComponentType()};
        }
        Type[] args = new Type[arity];
        if (declared instanceof ParameterizedType p && p.getActualTypeArguments().length == arity) {
            Type[] actual = p.getActualTypeArguments();
            for (int i = 0; i < arity; i++) {
                args[i] = bound(actual[i]);
            }
            return args;
        }
        if (slot == Slot.RUNTIME && instance != null) {
            if (instance instanceof Map<?, ?> m) {
                args[0] = infer(m.keySet());
                args[1] = infer(m.values());
            } else if (instance instanceof Collection<?> col) {
                args[0] = infer(col);
            } else if (instance instanceof AtomicReference<?> ref) {
                args[0] = ref.get() != null ? ref.get().getClass() : Object.class;
            } else {
                args[0] = Object.class;
            }
            return args;
        }
        Arrays.fill(args, Object.class);
        return args;
    }

    private static int arity(Class<?> raw, Shape shape) {
        return switch (shape) {
            case SLICE, CHAN -> 1;
            case MAP -> 2;
            case POINTER -> AtomicReference.class.isAssignableFrom(raw) ? 1 : 0;
            default -> 0;
        };
    }

    private static Type bound(Type t) {
        if (t instanceof WildcardType w) {
            Type[] upper = w.getUpperBounds();
            return upper.length > 0 ? bound(upper[0]) : Object.class;
        }
        if (t instanceof TypeVariable<?> v) {
            Type[] bounds = v.getBounds();
            return bounds.length > 0 ? bound(bounds[0]) : Object.class;
        }
        return t;
    }

    private static Type infer(Iterable<?> items) {
        Class<?> common = null;
        for (Object o : items) {
            if (o == null) continue;
            if (common == null) {
                common = o.getClass();
            } else if (common != o.getClass()) {
                return Object.class;
            }
        }
        return common != null ? common : Object.class;
    }

    static Class<?> rawClass(Type t) {
        Type b = bound(t);
        if (b instanceof Class<?> c) return c;
        if (b instanceof ParameterizedType p) return rawClass(p.getRawType());
        if (b instanceof GenericArrayType g) {
            return java.lang.reflect.Array.newInstance(rawClass(g.getGenericComponentType()), 0).getClass();
        }
        return Object.class;
    }

    // -----------------------------------------------------------------------
    // Go types
    // -----------------------------------------------------------------------

    static GoType goType(Class<?> raw, Shape shape, Type[] args) {
        return switch (shape) {
            case BOOL, INT, UINT, FLOAT -> PRIMITIVES.get(raw.isPrimitive() ? raw : UNBOXED.get(raw));
            case STRING -> raw == String.class ? GoType.STRING : named(enumClass(raw), Shape.STRING);
            case COMPLEX -> GoType.COMPLEX128;
            case SLICE -> GoType.sliceOf(declaredGoType(args[0], Slot.ELEMENT));
            case MAP -> GoType.mapOf(declaredGoType(args[0], Slot.ELEMENT), declaredGoType(args[1], Slot.ELEMENT));
            case CHAN -> GoType.chanOf(declaredGoType(args[0], Slot.ELEMENT));
            case POINTER -> {
                if (isBoxed(raw)) yield GoType.pointerTo(PRIMITIVES.get(UNBOXED.get(raw)));
                if (args.length == 1) yield GoType.pointerTo(declaredGoType(args[0], Slot.ELEMENT));
                yield GoType.pointerTo(named(raw, Shape.STRUCT));
            }
            case STRUCT -> named(raw, Shape.STRUCT);
            case INTERFACE -> GoType.INTERFACE;
            case FUNC -> GoType.FUNC;
            case OTHER -> GoType.OTHER;
            case INVALID -> GoType.INVALID;
        };
    }

    static GoType declaredGoType(Type declared, Slot slot) {
        Class<?> raw = rawClass(declared);
        Shape shape = classify(raw, slot);
        return goType(raw, shape, typeArguments(declared, raw, shape, slot, null));
    }

    static GoType named(Class<?> c, Shape kind) {
        GoPackage pkg = c.getAnnotation(GoPackage.class);
        if (pkg == null && c.getPackage() != null) {
            pkg = c.getPackage().getAnnotation(GoPackage.class);
        }
        String path = pkg != null ? pkg.value() : c.getPackageName().replace('.', '/');
        String pkgName = pkg != null && !pkg.name().isEmpty()
                ? pkg.name()
                : path.substring(path.lastIndexOf('/') + 1);
        GoName name = c.getAnnotation(GoName.class);
        return GoType.named(path, pkgName, name != null ? name.value() : c.getSimpleName(), kind);
    }

    static Class<?> enumClass(Class<?> c) {
        // Constants with a body are anonymous subclasses of the enum.
        return c.isEnum() ? c : c.getSuperclass();
    }

    // -----------------------------------------------------------------------
    // Struct fields
    // -----------------------------------------------------------------------

    /** Instance fields in declaration order, superclass fields first. */
    static List<Field> fields(Class<?> cls) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = cls; c != null && c != Object.class && !isJdk(c); c = c.getSuperclass()) {
            hierarchy.push(c);
        }
        List<Field> fields = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field f : c.getDeclaredFields()) {
                int mod = f.getModifiers();
                if (f.isSynthetic() || Modifier.isStatic(mod) || Modifier.isTransient(mod)) continue;
                fields.add(f);
            }
        }
        return fields;
    }

    static String fieldName(Field f) {
        GoName name = f.getAnnotation(GoName.class);
        if (name != null) {
            return name.value();
        }
        String n = f.getName();
        return Character.toUpperCase(n.charAt(0)) + n.substring(1);
    }
}
