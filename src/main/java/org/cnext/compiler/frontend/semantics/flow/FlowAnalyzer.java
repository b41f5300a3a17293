package org.cnext.compiler.frontend.semantics.flow;

import org.cnext.compiler.diagnostics.DiagnosticsEngine;
import org.cnext.compiler.frontend.parser.ast.Declaration;
import org.cnext.compiler.frontend.parser.ast.Expression;
import org.cnext.compiler.frontend.parser.ast.Program;
import org.cnext.compiler.frontend.parser.ast.Statement;
import org.cnext.compiler.frontend.semantics.Symbol;
import org.cnext.compiler.frontend.semantics.SymbolTable;
import org.cnext.compiler.frontend.semantics.analysis.FunctionSignatureRegistry;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Walks function bodies path by path and threads a {@link FlowState} through them for a set
 * of {@link IFlowRule}s. Branches work on copies of the state that are joined afterwards.
 * A loop is walked until the state at its head stops changing, so whatever one iteration
 * leaves behind is seen by the next; its body may also run zero times.
 * Statements after a {@code return} are not analyzed.
 */
public class FlowAnalyzer {

    // Every lattice has a height of at most two, so a loop settles long before this.
    private static final int MAX_LOOP_PASSES = 16;

    private final List<IFlowRule> rules;
    private final SymbolTable symbolTable;
    private int speculativeDepth;

    public FlowAnalyzer(List<IFlowRule> rules, SymbolTable symbolTable) {
        this.rules = List.copyOf(rules);
        this.symbolTable = symbolTable;
    }

    /**
     * Creates an analyzer carrying definite initialization and null safety.
     */
    public static FlowAnalyzer withDefaultRules(SymbolTable symbolTable, FunctionSignatureRegistry signatures,
                                                DiagnosticsEngine diagnostics) {
        List<IFlowRule> rules = new ArrayList<>();
        rules.add(new InitializationRule(signatures, diagnostics));
        rules.add(new NullSafetyRule(symbolTable, diagnostics));
        return new FlowAnalyzer(rules, symbolTable);
    }

    public void analyze(Program program) {
        for (Declaration declaration : program.declarations()) {
            if (declaration instanceof Declaration.FunctionDecl function) {
                analyzeFunction(function);
            }
        }
    }

    public void analyzeFunction(Declaration.FunctionDecl function) {
        FlowState state = new FlowState();
        for (IFlowRule rule : rules) {
            rule.enterFunction(function, state);
        }
        block(function.body(), state);
    }

    private FlowState block(Statement.Block block, FlowState state) {
        FlowState current = state;
        for (Statement statement : block.statements()) {
            if (current.isUnreachable()) {
                break;
            }
            current = statement(statement, current);
        }
        return current;
    }

    private FlowState statement(Statement statement, FlowState state) {
        if (statement instanceof Statement.Block b) {
            return block(b, state);
        }
        if (statement instanceof Statement.VariableDeclaration declaration) {
            rules.forEach(r -> r.declare(declaration, state));
            return state;
        }
        if (statement instanceof Statement.Assignment assignment) {
            rules.forEach(r -> r.assign(assignment, state));
            return state;
        }
        if (statement instanceof Statement.ExpressionStatement e) {
            evaluate(e.expression(), state);
            return state;
        }
        if (statement instanceof Statement.If i) {
            evaluate(i.condition(), state);
            FlowState thenState = state.copy();
            FlowState elseState = state.copy();
            refine(i.condition(), thenState, elseState);
            FlowState thenOut = block(i.thenBranch(), thenState);
            FlowState elseOut = i.elseBranch() == null ? elseState : statement(i.elseBranch(), elseState);
            return FlowState.join(thenOut, elseOut);
        }
        if (statement instanceof Statement.While w) {
            FlowState head = loopHead(state, h -> FlowState.join(state, whileIteration(w, h).bodyOut()));
            return whileIteration(w, head).exit();
        }
        if (statement instanceof Statement.DoWhile d) {
            FlowState head = loopHead(state, h -> FlowState.join(state, doWhileIteration(d, h).bodyOut()));
            return doWhileIteration(d, head).exit();
        }
        if (statement instanceof Statement.For f) {
            FlowState entry = f.init() == null ? state : statement(f.init(), state);
            FlowState head = loopHead(entry, h -> FlowState.join(entry, forIteration(f, h).bodyOut()));
            return forIteration(f, head).exit();
        }
        if (statement instanceof Statement.Switch s) {
            return switchStatement(s, state);
        }
        if (statement instanceof Statement.Return r) {
            if (r.value() != null) {
                evaluate(r.value(), state);
            }
            state.markUnreachable();
            return state;
        }
        return state;
    }

    // === Loops ===

    /** The states leaving one pass over a loop: through the condition, and around the back edge. */
    private record LoopPass(FlowState exit, FlowState bodyOut) {}

    private LoopPass whileIteration(Statement.While w, FlowState head) {
        FlowState start = head.copy();
        evaluate(w.condition(), start);
        FlowState body = start.copy();
        FlowState exit = start.copy();
        refine(w.condition(), body, exit);
        return new LoopPass(exit, block(w.body(), body));
    }

    private LoopPass doWhileIteration(Statement.DoWhile d, FlowState head) {
        FlowState out = block(d.body(), head.copy());
        if (out.isUnreachable()) {
            return new LoopPass(out, out);
        }
        evaluate(d.condition(), out);
        FlowState again = out.copy();
        FlowState exit = out.copy();
        refine(d.condition(), again, exit);
        return new LoopPass(exit, again);
    }

    private LoopPass forIteration(Statement.For f, FlowState head) {
        FlowState body = head.copy();
        FlowState exit = head.copy();
        if (f.condition() != null) {
            evaluate(f.condition(), body);
            exit = body.copy();
            refine(f.condition(), body, exit);
        }
        FlowState bodyOut = block(f.body(), body);
        if (!bodyOut.isUnreachable() && f.update() != null) {
            bodyOut = statement(f.update(), bodyOut);
        }
        return new LoopPass(exit, bodyOut);
    }

    /**
     * Computes the state at the top of a loop: the entry state met with everything the back
     * edge can carry around. The passes run with reporting off; the caller makes one more
     * pass over the loop from the returned state, and that one reports.
     */
    private FlowState loopHead(FlowState entry, UnaryOperator<FlowState> iteration) {
        FlowState head = entry.copy();
        muteRules();
        try {
            for (int i = 0; i < MAX_LOOP_PASSES; i++) {
                FlowState next = iteration.apply(head);
                if (next.equals(head)) {
                    break;
                }
                head = next;
            }
        } finally {
            unmuteRules();
        }
        return head;
    }

    private void muteRules() {
        if (speculativeDepth++ == 0) {
            rules.forEach(rule -> rule.setReporting(false));
        }
    }

    private void unmuteRules() {
        if (--speculativeDepth == 0) {
            rules.forEach(rule -> rule.setReporting(true));
        }
    }

    private FlowState switchStatement(Statement.Switch s, FlowState state) {
        evaluate(s.subject(), state);
        List<FlowState> outs = new ArrayList<>();
        for (Statement.SwitchCase c : s.cases()) {
            outs.add(block(c.body(), state.copy()));
        }
        if (s.defaultCase() != null) {
            outs.add(block(s.defaultCase().body(), state.copy()));
        } else if (!coversAllVariants(s)) {
            outs.add(state.copy());
        }
        if (outs.isEmpty()) {
            return state;
        }
        FlowState result = outs.get(0);
        for (int i = 1; i < outs.size(); i++) {
            result = FlowState.join(result, outs.get(i));
        }
        return result;
    }

    // A switch without default reaches its end without running a case unless every enum variant has one.
    private boolean coversAllVariants(Statement.Switch s) {
        Symbol.EnumSymbol enumSymbol = null;
        Set<String> covered = new HashSet<>();
        for (Statement.SwitchCase c : s.cases()) {
            for (Expression label : c.labels()) {
                Optional<Symbol.EnumSymbol> owner = Optional.empty();
                String variant = null;
                if (label instanceof Expression.MemberAccess access
                        && access.target() instanceof Expression.Identifier type) {
                    owner = symbolTable.resolveEnum(type.name());
                    variant = access.member();
                } else if (label instanceof Expression.Identifier identifier) {
                    owner = symbolTable.resolveEnumMemberOwner(identifier.name());
                    variant = identifier.name();
                }
                if (owner.isEmpty() || (enumSymbol != null && !enumSymbol.equals(owner.get()))) {
                    return false;
                }
                enumSymbol = owner.get();
                covered.add(variant);
            }
        }
        return enumSymbol != null && covered.containsAll(enumSymbol.members().keySet());
    }

    private void evaluate(Expression expression, FlowState state) {
        for (IFlowRule rule : rules) {
            rule.evaluate(expression, state);
        }
    }

    private void refine(Expression condition, FlowState whenTrue, FlowState whenFalse) {
        for (IFlowRule rule : rules) {
            rule.refine(condition, whenTrue, whenFalse);
        }
    }
}
