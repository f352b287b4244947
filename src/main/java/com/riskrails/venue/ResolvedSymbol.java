package com.riskrails.venue;

import lombok.Value;

/**
 * A symbol split into its base part and the venue it routes to. {@code market} is the
 * pass-through market label (e.g. {@code margin}), null when none was given.
 */
@Value
public class ResolvedSymbol {

    String base;
    String venue;
    String market;
}
