package pl.marcinmilkowski.ident_gen.substitution;

/**
 * One entry of the lookup table: a lowercase term and the abbreviation replacing it.
 */
public record SubstitutionPattern(
    String term,            // lowercase full term or morphological variant
    String abbreviation
) {

    @Override
    public String toString() {
        return term + " -> " + abbreviation;
    }
}
