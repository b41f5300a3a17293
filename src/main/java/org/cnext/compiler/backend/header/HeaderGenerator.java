package org.cnext.compiler.backend.header;

import java.util.List;
import java.util.Locale;

/**
 * Renders the header of a generated unit: an include guard, the standard includes, the
 * unit's own includes, then types, register macros, {@code extern} globals and prototypes.
 */
public class HeaderGenerator {

    /**
     * Renders a header.
     *
     * @param headerFileName The file name of the header, used to derive the include guard.
     * @param model          The exported declarations.
     * @return the header text.
     */
    public String render(String headerFileName, HeaderModel model) {
        String guard = guardName(headerFileName);
        StringBuilder out = new StringBuilder();
        out.append("#ifndef ").append(guard).append('\n');
        out.append("#define ").append(guard).append('\n');
        out.append('\n');
        out.append("#include <stdint.h>\n");
        out.append("#include <stdbool.h>\n");
        for (String include : model.includes()) {
            out.append(include).append('\n');
        }
        section(out, model.types(), true);
        section(out, model.registerMacros(), false);
        section(out, model.externs(), false);
        section(out, model.prototypes(), false);
        out.append('\n');
        out.append("#endif /* ").append(guard).append(" */\n");
        return out.toString();
    }

    private static void section(StringBuilder out, List<String> entries, boolean separateEntries) {
        if (entries.isEmpty()) {
            return;
        }
        out.append('\n');
        for (int i = 0; i < entries.size(); i++) {
            if (separateEntries && i > 0) {
                out.append('\n');
            }
            String entry = entries.get(i);
            out.append(entry);
            if (!entry.endsWith("\n")) {
                out.append('\n');
            }
        }
    }

    /**
     * Derives the include guard, e.g. {@code motor_control.h -> MOTOR_CONTROL_H}.
     */
    static String guardName(String headerFileName) {
        String guard = headerFileName.replaceAll("[^A-Za-z0-9]", "_").toUpperCase(Locale.ROOT);
        return Character.isDigit(guard.charAt(0)) ? "_" + guard : guard;
    }
}
