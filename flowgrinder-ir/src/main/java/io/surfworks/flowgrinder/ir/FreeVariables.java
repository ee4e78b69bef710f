package io.surfworks.flowgrinder.ir;

import io.surfworks.flowgrinder.ir.TensorIr.Call;
import io.surfworks.flowgrinder.ir.TensorIr.Constant;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;
import io.surfworks.flowgrinder.ir.TensorIr.Tuple;
import io.surfworks.flowgrinder.ir.TensorIr.TupleGetItem;
import io.surfworks.flowgrinder.ir.TensorIr.Var;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the variables an expression depends on.
 *
 * <p>The IR has no binders, so every reachable {@link Var} is free. Variables
 * are returned in first-seen order of a left-to-right depth-first walk, each
 * once. Shared subexpressions are visited once.
 */
public final class FreeVariables {

    private FreeVariables() {}

    /**
     * Returns the free variables of {@code expr} in first-seen order.
     */
    public static List<Var> of(Expr expr) {
        Set<Var> found = new LinkedHashSet<>();
        Set<Expr> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Expr> stack = new ArrayDeque<>();
        stack.push(expr);

        while (!stack.isEmpty()) {
            Expr current = stack.pop();
            if (!visited.add(current)) {
                continue;
            }
            List<Expr> children = children(current);
            if (current instanceof Var var) {
                found.add(var);
            }
            // Push in reverse so the leftmost operand is walked first
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return new ArrayList<>(found);
    }

    /**
     * Returns the direct operands of an expression.
     */
    static List<Expr> children(Expr expr) {
        if (expr instanceof Call call) {
            return call.args();
        } else if (expr instanceof Tuple tuple) {
            return tuple.fields();
        } else if (expr instanceof TupleGetItem item) {
            return List.of(item.tuple());
        } else if (expr instanceof Var || expr instanceof Constant) {
            return List.of();
        }
        throw new IrException("Unknown expression kind: " + expr.getClass().getSimpleName());
    }
}
