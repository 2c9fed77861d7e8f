package org.dxworks.manuscript.math;

/**
 * Raised for LaTeX that has no sensible tree: unbalanced braces, a missing or mismatched {@code \end},
 * or an environment without an OMML counterpart.
 */
public class MathSyntaxException extends RuntimeException {

    public MathSyntaxException(String message) {
        super(message);
    }
}
