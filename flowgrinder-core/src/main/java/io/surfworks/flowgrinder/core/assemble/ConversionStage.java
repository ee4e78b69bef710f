package io.surfworks.flowgrinder.core.assemble;

/**
 * Assembly stages, run strictly in declaration order.
 */
public enum ConversionStage {
    COLLECT_DECLARED_INPUTS("CollectDeclaredInputs"),
    VALIDATE_OPERATOR_COVERAGE("ValidateOperatorCoverage"),
    CONVERT_OPERATORS("ConvertOperators"),
    COLLECT_GRAPH_OUTPUTS("CollectGraphOutputs"),
    COMPUTE_FREE_VARIABLES("ComputeFreeVariables"),
    ORDER_INPUTS_AND_BUILD_FUNCTION("OrderInputsAndBuildFunction");

    private final String displayName;

    ConversionStage(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
