package org.csu.svrf2pxl.codegen;

/**
 * Key of an operation table entry: an IR operation or measurement name (or one of the
 * statement kinds {@code LAYER}, {@code REPORT}) plus the number of layer operands.
 *
 * @param arity operand count, or {@link #ANY_ARITY} for an entry that fits every count
 */
public record OperationKey(String kind, int arity) {

    public static final int ANY_ARITY = -1;

    public static OperationKey any(String kind) {
        return new OperationKey(kind, ANY_ARITY);
    }

    /**
     * Parses {@code KIND} or {@code KIND/arity}.
     */
    public static OperationKey parse(String text) {
        String trimmed = text.trim();
        int slash = trimmed.indexOf('/');
        if (slash < 0) {
            return any(trimmed.toUpperCase());
        }
        String kind = trimmed.substring(0, slash).trim().toUpperCase();
        try {
            int arity = Integer.parseInt(trimmed.substring(slash + 1).trim());
            if (arity < 0) {
                throw new IllegalArgumentException("Negative arity in operation key '" + text + "'");
            }
            return new OperationKey(kind, arity);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid arity in operation key '" + text + "'", e);
        }
    }

    @Override
    public String toString() {
        return arity == ANY_ARITY ? kind : kind + "/" + arity;
    }
}
