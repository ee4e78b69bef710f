package io.surfworks.flowgrinder.core.assemble;

import io.surfworks.flowgrinder.core.checkpoint.TensorBuffer;
import io.surfworks.flowgrinder.ir.IrPrinter;
import io.surfworks.flowgrinder.ir.TensorIr.Module;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of a conversion run.
 *
 * @param module the IR module; its {@code main} function is the converted graph
 * @param params parameter symbol name to tensor, for every parameter in the
 *               function signature, in signature order
 */
public record ConversionResult(Module module, Map<String, TensorBuffer> params) {

    public ConversionResult {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public String print() {
        return IrPrinter.print(module);
    }
}
