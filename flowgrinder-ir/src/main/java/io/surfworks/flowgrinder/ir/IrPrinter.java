package io.surfworks.flowgrinder.ir;

import io.surfworks.flowgrinder.ir.TensorIr.Attr;
import io.surfworks.flowgrinder.ir.TensorIr.Call;
import io.surfworks.flowgrinder.ir.TensorIr.Constant;
import io.surfworks.flowgrinder.ir.TensorIr.Expr;
import io.surfworks.flowgrinder.ir.TensorIr.Function;
import io.surfworks.flowgrinder.ir.TensorIr.Module;
import io.surfworks.flowgrinder.ir.TensorIr.Tuple;
import io.surfworks.flowgrinder.ir.TensorIr.TupleGetItem;
import io.surfworks.flowgrinder.ir.TensorIr.Var;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Renders IR modules as text.
 *
 * Every call, tuple and projection is bound to a numbered temporary so that
 * shared subexpressions print once:
 * <pre>
 * def @main(%Input_0: Tensor[(1, 3, 32, 32), float32], ...) -> Tensor[...] {
 *   %0 = nn.conv2d(%Input_0, %conv1-weight, strides=[1, 1], ...) /* ty=Tensor[...] *&#47;;
 *   %1 = relu(%0) /* ty=Tensor[...] *&#47;;
 *   %1
 * }
 * </pre>
 */
public final class IrPrinter {

    private final StringBuilder sb = new StringBuilder();
    private final Map<Expr, String> temporaries = new IdentityHashMap<>();

    /**
     * Renders a module.
     */
    public static String print(Module module) {
        return "// module @" + module.name() + "\n" + print(module.main());
    }

    /**
     * Renders a function named {@code main}.
     */
    public static String print(Function function) {
        return new IrPrinter().emitFunction(function);
    }

    private String emitFunction(Function function) {
        sb.append("def @main(");
        for (int i = 0; i < function.params().size(); i++) {
            if (i > 0) sb.append(", ");
            Var param = function.params().get(i);
            sb.append("%").append(param.name()).append(": ").append(param.type().toIrString());
        }
        sb.append(") -> ").append(function.returnType().toIrString()).append(" {\n");
        String result = emit(function.body());
        sb.append("  ").append(result).append("\n}\n");
        return sb.toString();
    }

    private String emit(Expr expr) {
        if (expr instanceof Var var) {
            return "%" + var.name();
        }
        if (expr instanceof Constant constant) {
            return constantText(constant);
        }
        String existing = temporaries.get(expr);
        if (existing != null) {
            return existing;
        }

        String text;
        if (expr instanceof Call call) {
            StringBuilder args = new StringBuilder();
            for (Expr arg : call.args()) {
                if (args.length() > 0) args.append(", ");
                args.append(emit(arg));
            }
            for (Map.Entry<String, Attr> attr : call.attrs().entrySet()) {
                if (args.length() > 0) args.append(", ");
                args.append(attr.getKey()).append("=").append(attr.getValue().toIrString());
            }
            text = call.op() + "(" + args + ")";
        } else if (expr instanceof Tuple tuple) {
            StringBuilder fields = new StringBuilder();
            for (Expr field : tuple.fields()) {
                if (fields.length() > 0) fields.append(", ");
                fields.append(emit(field));
            }
            text = "(" + fields + ")";
        } else if (expr instanceof TupleGetItem item) {
            text = emit(item.tuple()) + "." + item.index();
        } else {
            throw new IrException("Unknown expression kind: " + expr.getClass().getSimpleName());
        }

        String name = "%" + temporaries.size();
        temporaries.put(expr, name);
        sb.append("  ").append(name).append(" = ").append(text)
                .append(" /* ty=").append(expr.type().toIrString()).append(" */;\n");
        return name;
    }

    private static String constantText(Constant constant) {
        if (constant.isSplat()) {
            return constant.values().get(0) + ":" + constant.type().elementType() + shapeSuffix(constant);
        }
        return "meta[Constant]" + constant.values() + shapeSuffix(constant);
    }

    private static String shapeSuffix(Constant constant) {
        return constant.type().rank() == 0 ? "" : " /* ty=" + constant.type().toIrString() + " */";
    }
}
