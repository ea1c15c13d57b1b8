package group.cloudtrailsource.source;

/**
 * Scope of one paginated key listing. startAfter may be null.
 */
public record ListingCursor(
        String prefix,
        String startAfter
) {
}
