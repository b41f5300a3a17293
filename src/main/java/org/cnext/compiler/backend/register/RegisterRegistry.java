package org.cnext.compiler.backend.register;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The register blocks of the compilation run, shared by every unit.
 */
public class RegisterRegistry {

    private final Map<String, RegisterBinding> registers = new HashMap<>();

    /**
     * Records a register block.
     * @return false if a block of that name already exists.
     */
    public boolean register(RegisterBinding binding) {
        return registers.putIfAbsent(binding.name(), binding) == null;
    }

    public Optional<RegisterBinding> resolve(String name) {
        return Optional.ofNullable(registers.get(name));
    }

    public boolean isRegister(String name) {
        return registers.containsKey(name);
    }
}
