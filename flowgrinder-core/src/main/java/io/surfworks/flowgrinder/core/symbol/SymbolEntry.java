package io.surfworks.flowgrinder.core.symbol;

import io.surfworks.flowgrinder.ir.TensorIr.Expr;
import io.surfworks.flowgrinder.ir.TensorIr.Type;

/**
 * A named IR value bound to a storage path.
 */
public record SymbolEntry(String name, Expr value, Type type) {

    public static SymbolEntry of(String name, Expr value) {
        return new SymbolEntry(name, value, value.type());
    }
}
