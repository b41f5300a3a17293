package org.cnext.compiler.backend.register;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A memory-mapped register block bound to a base address.
 *
 * @param name        The block name.
 * @param baseAddress The base address as C text.
 * @param fields      The fields in declaration order.
 */
public record RegisterBinding(String name, String baseAddress, Map<String, RegisterField> fields) {

    public RegisterBinding {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public Optional<RegisterField> field(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    /**
     * The name of the macro through which a field is accessed, e.g. {@code GPIO_DR}.
     */
    public String macroName(RegisterField field) {
        return name + "_" + field.name();
    }
}
