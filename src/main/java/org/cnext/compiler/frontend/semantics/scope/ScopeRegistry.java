package org.cnext.compiler.frontend.semantics.scope;

import org.cnext.compiler.frontend.parser.ast.Declaration;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Knows every scope of the compilation run and the visibility of its members. Scopes of
 * an included unit are registered before the including unit is flattened.
 */
public class ScopeRegistry {

    /**
     * A member of a scope.
     *
     * @param name       The member name as written inside the scope.
     * @param isPublic   True if accessible from outside the scope.
     * @param isFunction True for functions, false for variables.
     */
    public record ScopeMember(String name, boolean isPublic, boolean isFunction) {}

    private final Map<String, Map<String, ScopeMember>> scopes = new HashMap<>();

    /**
     * Records a scope and its members.
     */
    public void register(Declaration.ScopeDecl scope) {
        Map<String, ScopeMember> members = new LinkedHashMap<>();
        for (Declaration member : scope.members()) {
            if (member instanceof Declaration.FunctionDecl function) {
                members.put(function.name(), new ScopeMember(function.name(), function.isPublic(), true));
            } else if (member instanceof Declaration.VariableDecl variable) {
                members.put(variable.name(), new ScopeMember(variable.name(), variable.isPublic(), false));
            }
        }
        scopes.put(scope.name(), Collections.unmodifiableMap(members));
    }

    public boolean isScope(String name) {
        return scopes.containsKey(name);
    }

    /**
     * Looks up a member of a scope.
     */
    public Optional<ScopeMember> member(String scope, String member) {
        Map<String, ScopeMember> members = scopes.get(scope);
        return members == null ? Optional.empty() : Optional.ofNullable(members.get(member));
    }

    /**
     * The flat C name of a scope member.
     */
    public static String flatName(String scope, String member) {
        return scope + "_" + member;
    }
}
