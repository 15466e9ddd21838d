package org.spacompose.params;

/**
 * A synaptic time constant in seconds. Must be a non-negative finite number.
 */
public class SynapseParam extends Param<Double> {

    public SynapseParam(String name, double defaultValue) {
        super(name, defaultValue);
    }

    @Override
    public Double validate(String owner, Object raw) {
        double value;
        if (raw instanceof Number n) {
            value = n.doubleValue();
        } else if (raw instanceof String s) {
            try {
                value = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new FieldValidationException(owner, name(), "must be a number", raw, e);
            }
        } else {
            throw new FieldValidationException(owner, name(), "must be a number", raw, null);
        }
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new FieldValidationException(owner, name(), "must be a non-negative time constant", raw, null);
        }
        return value;
    }
}
