package org.cnext.compiler.frontend.semantics.flow;

import org.cnext.compiler.frontend.parser.ast.Declaration;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.Statement;

/**
 * One analysis carried by the {@link FlowAnalyzer}. The analyzer owns control flow (copying
 * the state into branches and joining it afterwards); a rule only interprets the
 * individual statements and expressions on the state it is handed.
 */
public interface IFlowRule {

    /**
     * Called once per function before its body is walked.
     */
    default void enterFunction(Declaration.FunctionDecl function, FlowState state) {}

    /**
     * Called for a local declaration. The rule evaluates the initializer itself.
     */
    void declare(Statement.VariableDeclaration declaration, FlowState state);

    /**
     * Called for an assignment. The rule evaluates the value and the target itself.
     */
    void assign(Statement.Assignment assignment, FlowState state);

    /**
     * Called for every expression evaluated in its own right: conditions, initializers,
     * expression statements, returned values and switch subjects.
     */
    void evaluate(Expression expression, FlowState state);

    /**
     * Narrows the states of the two branches of a condition.
     */
    default void refine(Expression condition, FlowState whenTrue, FlowState whenFalse) {}

    /**
     * Turns diagnostics on or off. The analyzer turns them off while it works out the state at
     * the head of a loop, and walks the loop once more with them on.
     */
    default void setReporting(boolean enabled) {}
}
