package io.surfworks.qhal.backend;

import java.util.List;

/**
 * Outcome of checking a circuit against backend constraints.
 *
 * <p>Three cases:
 * <ul>
 *   <li>valid: the circuit can be submitted as-is</li>
 *   <li>invalid: the circuit cannot run on this backend; {@code reasons} says why</li>
 *   <li>needs transpilation: the circuit is structurally fine but must be
 *       rewritten for the native gate set or topology first</li>
 * </ul>
 *
 * @param isValid                True only if the circuit can be submitted unchanged
 * @param reasons                Why the circuit is invalid (empty otherwise)
 * @param requiresTranspilation  True if rewriting would make the circuit runnable
 * @param transpilationDetails   What rewriting is needed (null otherwise)
 */
public record ValidationResult(
        boolean isValid,
        List<String> reasons,
        boolean requiresTranspilation,
        String transpilationDetails
) {

    private static final ValidationResult VALID = new ValidationResult(true, List.of(), false, null);

    public ValidationResult {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        if (isValid && (requiresTranspilation || !reasons.isEmpty())) {
            throw new IllegalArgumentException("a valid result cannot carry reasons or need transpilation");
        }
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(List<String> reasons) {
        return new ValidationResult(false, reasons, false, null);
    }

    public static ValidationResult invalid(String reason) {
        return invalid(List.of(reason));
    }

    public static ValidationResult needsTranspilation(String details) {
        return new ValidationResult(false, List.of(), true, details);
    }

    /**
     * Returns true if the circuit cannot run here even after transpilation.
     */
    public boolean isInvalid() {
        return !isValid && !requiresTranspilation;
    }
}
