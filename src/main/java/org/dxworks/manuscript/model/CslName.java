package org.dxworks.manuscript.model;

/**
 * Author name as carried in CSL item data. Institutional authors only have a literal.
 */
public record CslName(String family, String given, String literal) {

    public String familyOrLiteral() {
        if (family != null && !family.isBlank()) {
            return family;
        }
        return literal == null ? "" : literal;
    }
}
