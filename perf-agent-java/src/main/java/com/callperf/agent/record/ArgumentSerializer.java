package com.callperf.agent.record;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.*;

/**
 * Captures an argument as a flat, size-bounded {@code Map<String, String>} snapshot.
 *
 * Rules:
 * - Scalars (primitives, boxed numbers, String, enums): {"value": text}
 * - Objects: one entry per non-static field, walking superclasses up to Object
 * - Arrays, collections and maps: "length" plus up to maxElements indexed entries
 * - At the depth limit an object is rendered as "<SimpleName>"
 * - Re-visited objects are rendered as "<circular>"
 * - Every value is truncated to maxValueLength characters
 */
public final class ArgumentSerializer {

    private ArgumentSerializer() {}

    public static List<Map<String, String>> serializeAll(Object[] args, ArgumentLimits limits) {
        if (args == null || args.length == 0) return List.of();
        List<Map<String, String>> snapshots = new ArrayList<>(args.length);
        for (Object arg : args) {
            snapshots.add(serialize(arg, limits));
        }
        return snapshots;
    }

    public static Map<String, String> serialize(Object obj, ArgumentLimits limits) {
        Map<String, String> out = new LinkedHashMap<>();
        if (obj == null) return out;
        new Walk(limits, out).value(obj, 0, "");
        return out;
    }

    static boolean isScalar(Class<?> cls) {
        return cls.isPrimitive()
            || cls == String.class
            || cls == Boolean.class
            || cls == Character.class
            || cls.isEnum()
            || Number.class.isAssignableFrom(cls) && cls.getPackageName().startsWith("java.");
    }

    private static final class Walk {
        private final ArgumentLimits limits;
        private final Map<String, String> out;
        private final IdentityHashMap<Object, Boolean> visiting = new IdentityHashMap<>();

        Walk(ArgumentLimits limits, Map<String, String> out) {
            this.limits = limits;
            this.out = out;
        }

        void value(Object obj, int depth, String key) {
            if (obj == null) {
                put(key, "null");
            } else if (isScalar(obj.getClass())) {
                put(key, String.valueOf(obj));
            } else if (visiting.containsKey(obj)) {
                put(key, "<circular>");
            } else if (obj.getClass().isArray()) {
                int len = Array.getLength(obj);
                List<Object> head = new ArrayList<>();
                for (int i = 0; i < Math.min(len, limits.maxElements()); i++) head.add(Array.get(obj, i));
                container(obj, len, head, depth, key);
            } else if (obj instanceof Collection<?> col) {
                List<Object> head = new ArrayList<>();
                for (Object elem : col) {
                    if (head.size() >= limits.maxElements()) break;
                    head.add(elem);
                }
                container(obj, col.size(), head, depth, key);
            } else if (obj instanceof Map<?, ?> map) {
                put(child(key, "length"), String.valueOf(map.size()));
                visiting.put(obj, Boolean.TRUE);
                try {
                    int count = 0;
                    for (Map.Entry<?, ?> entry : map.entrySet()) {
                        if (count++ >= limits.maxElements()) break;
                        nested(entry.getValue(), depth, key + "[" + entry.getKey() + "]");
                    }
                } finally {
                    visiting.remove(obj);
                }
            } else if (depth >= limits.depthLimit()) {
                put(key, "<" + obj.getClass().getSimpleName() + ">");
            } else {
                fields(obj, depth, key);
            }
        }

        private void container(Object owner, int length, List<Object> head, int depth, String key) {
            put(child(key, "length"), String.valueOf(length));
            visiting.put(owner, Boolean.TRUE);
            try {
                for (int i = 0; i < head.size(); i++) {
                    nested(head.get(i), depth, key + "[" + i + "]");
                }
            } finally {
                visiting.remove(owner);
            }
        }

        private void fields(Object obj, int depth, String key) {
            visiting.put(obj, Boolean.TRUE);
            try {
                for (Class<?> c = obj.getClass(); c != null && c != Object.class; c = c.getSuperclass()) {
                    for (Field f : c.getDeclaredFields()) {
                        if (f.isSynthetic() || Modifier.isStatic(f.getModifiers())) continue;
                        Object fieldValue;
                        try {
                            f.setAccessible(true);
                            fieldValue = f.get(obj);
                        } catch (RuntimeException | IllegalAccessException e) {
                            // module system refuses access to JDK internals
                            put(child(key, f.getName()), "<inaccessible>");
                            continue;
                        }
                        nested(fieldValue, depth, child(key, f.getName()));
                    }
                }
            } finally {
                visiting.remove(obj);
            }
        }

        private void nested(Object obj, int parentDepth, String key) {
            if (obj != null && !isScalar(obj.getClass()) && parentDepth + 1 >= limits.depthLimit()
                    && !visiting.containsKey(obj)) {
                put(key, "<" + obj.getClass().getSimpleName() + ">");
            } else {
                value(obj, parentDepth + 1, key);
            }
        }

        private void put(String key, String text) {
            String k = key.isEmpty() ? "value" : key;
            int max = limits.maxValueLength();
            out.put(k, max > 0 && text.length() > max ? text.substring(0, max) + "..." : text);
        }

        private static String child(String prefix, String name) {
            return prefix.isEmpty() ? name : prefix + "." + name;
        }
    }
}
