package com.algoclock.domain.model;

import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Securities that entered and left the algorithm's universe in one universe update.
 */
@Getter
@ToString
public class SecurityChanges {

    private static final SecurityChanges NONE = new SecurityChanges(List.of(), List.of());

    private final List<Security> addedSecurities;
    private final List<Security> removedSecurities;

    private SecurityChanges(List<Security> addedSecurities, List<Security> removedSecurities) {
        this.addedSecurities = addedSecurities;
        this.removedSecurities = removedSecurities;
    }

    public static SecurityChanges of(List<Security> added, List<Security> removed) {
        return new SecurityChanges(List.copyOf(added), List.copyOf(removed));
    }

    public static SecurityChanges added(Security... securities) {
        return new SecurityChanges(List.of(securities), List.of());
    }

    public static SecurityChanges removed(Security... securities) {
        return new SecurityChanges(List.of(), List.of(securities));
    }

    public static SecurityChanges none() {
        return NONE;
    }

    public boolean isEmpty() {
        return addedSecurities.isEmpty() && removedSecurities.isEmpty();
    }
}
