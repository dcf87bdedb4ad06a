package io.fieldtree.core.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record Directive(String name, Map<String, ArgumentValue> arguments) {

    public Directive {
        Objects.requireNonNull(name, "name");
        arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments == null ? Map.of() : arguments));
    }

    public static Directive of(String name) {
        return new Directive(name, Map.of());
    }

    public static Directive of(String name, String argName, ArgumentValue value) {
        return new Directive(name, Map.of(argName, value));
    }

    public ArgumentValue argument(String argName) {
        return arguments.get(argName);
    }
}
