package org.spacompose.params;

/**
 * An integer parameter with an inclusive lower bound. Accepts integral numbers and numeric strings.
 */
public class IntParam extends Param<Integer> {

    private final int low;

    /**
     * @param name         The parameter name.
     * @param defaultValue The built-in default.
     * @param low          The smallest accepted value.
     */
    public IntParam(String name, int defaultValue, int low) {
        super(name, defaultValue);
        this.low = low;
    }

    @Override
    public Integer validate(String owner, Object raw) {
        int value = convert(owner, raw);
        if (value < low) {
            throw new FieldValidationException(owner, name(), "must be >= " + low, raw, null);
        }
        return value;
    }

    private int convert(String owner, Object raw) {
        if (raw instanceof Integer i) {
            return i;
        }
        if (raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            try {
                return Math.toIntExact(((Number) raw).longValue());
            } catch (ArithmeticException e) {
                throw new FieldValidationException(owner, name(), "must fit in an int", raw, e);
            }
        }
        if (raw instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                throw new FieldValidationException(owner, name(), "must be an integer", raw, e);
            }
        }
        throw new FieldValidationException(owner, name(), "must be an integer", raw, null);
    }

    public int low() {
        return low;
    }
}
