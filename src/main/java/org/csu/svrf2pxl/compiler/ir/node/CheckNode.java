package org.csu.svrf2pxl.compiler.ir.node;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/**
 * A design rule check: a measurement over one or more layers compared with a threshold,
 * reported under a rule name.
 */
@Getter
public class CheckNode extends IrNode {
    private final Measurement measurement;
    private final List<String> targets;
    // extra numeric arguments of the measurement, rendered
    private final List<String> parameters;
    private final Comparator comparator;
    private final double threshold;
    private final String ruleName;
    private final String message;

    public CheckNode(String symbol, int line, Measurement measurement, List<String> targets, List<String> parameters,
                     Comparator comparator, double threshold, String ruleName, String message) {
        super(symbol, line, false);
        this.measurement = measurement;
        this.targets = List.copyOf(targets);
        this.parameters = List.copyOf(parameters);
        this.comparator = comparator;
        this.threshold = threshold;
        this.ruleName = ruleName;
        this.message = message;
    }

    /**
     * The threshold without trailing zeros or exponent, e.g. {@code 0.09}.
     */
    public String getFormattedThreshold() {
        return formatNumber(threshold);
    }

    /**
     * Whether the message came from the rule's own description rather than {@link #defaultMessage}.
     */
    public boolean hasDescription() {
        return !message.equals(defaultMessage(measurement, comparator, threshold));
    }

    public static String defaultMessage(Measurement measurement, Comparator comparator, double threshold) {
        return String.format("%s violation: %s %s%s", measurement.displayName(), comparator.symbol(),
                formatNumber(threshold), measurement.unit());
    }

    @Override
    public List<String> getDependencies() {
        return targets;
    }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder(measurement.name());
        targets.forEach(t -> sb.append(' ').append(t));
        parameters.forEach(p -> sb.append(' ').append(p));
        return sb.append(' ').append(comparator.symbol()).append(' ').append(getFormattedThreshold()).toString();
    }

    public static String formatNumber(double value) {
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        if (decimal.scale() < 0) {
            decimal = decimal.setScale(0);
        }
        return decimal.toPlainString();
    }
}
