package org.cnext.compiler.backend.header;

import java.util.ArrayList;
import java.util.List;

/**
 * The declarations a unit exports through its generated header, in emission order within
 * each section.
 */
public class HeaderModel {

    private final List<String> includes = new ArrayList<>();
    private final List<String> types = new ArrayList<>();
    private final List<String> registerMacros = new ArrayList<>();
    private final List<String> externs = new ArrayList<>();
    private final List<String> prototypes = new ArrayList<>();

    /**
     * Adds an include line, e.g. {@code #include "motor.h"}. Repeated lines are kept once.
     */
    public void addInclude(String line) {
        if (!includes.contains(line)) {
            includes.add(line);
        }
    }

    /**
     * Adds a complete type definition, possibly spanning several lines.
     */
    public void addType(String definition) {
        types.add(definition);
    }

    public void addRegisterMacro(String line) {
        registerMacros.add(line);
    }

    public void addExtern(String line) {
        externs.add(line);
    }

    public void addPrototype(String line) {
        prototypes.add(line);
    }

    public List<String> includes() {
        return List.copyOf(includes);
    }

    public List<String> types() {
        return List.copyOf(types);
    }

    public List<String> registerMacros() {
        return List.copyOf(registerMacros);
    }

    public List<String> externs() {
        return List.copyOf(externs);
    }

    public List<String> prototypes() {
        return List.copyOf(prototypes);
    }
}
