package org.csu.svrf2pxl.compiler.ir.node;

import lombok.Getter;

import java.util.List;

/**
 * A layer computed from other layers.
 */
@Getter
public class DerivedNode extends IrNode {
    private final Operation operation;
    private final List<String> operands;
    // numeric arguments after the operands, already rendered (e.g. "0.1", or "<", "0.5" for SELECT_AREA)
    private final List<String> parameters;
    // only set for EXTERNAL_FUNCTION
    private final String functionName;
    // set when the derived layer itself is a reported rule result (bare expression in a rule block)
    private final String ruleName;
    private final String message;

    public DerivedNode(String symbol, int line, boolean synthetic, Operation operation,
                       List<String> operands, List<String> parameters) {
        this(symbol, line, synthetic, operation, operands, parameters, null, null, null);
    }

    public DerivedNode(String symbol, int line, boolean synthetic, Operation operation, List<String> operands,
                       List<String> parameters, String functionName, String ruleName, String message) {
        super(symbol, line, synthetic);
        this.operation = operation;
        this.operands = List.copyOf(operands);
        this.parameters = List.copyOf(parameters);
        this.functionName = functionName;
        this.ruleName = ruleName;
        this.message = message;
    }

    public boolean isReported() {
        return ruleName != null;
    }

    @Override
    public List<String> getDependencies() {
        return operands;
    }

    @Override
    public String describe() {
        String name = operation == Operation.EXTERNAL_FUNCTION ? functionName : operation.name();
        StringBuilder sb = new StringBuilder(name);
        operands.forEach(o -> sb.append(' ').append(o));
        parameters.forEach(p -> sb.append(' ').append(p));
        return sb.toString();
    }
}
