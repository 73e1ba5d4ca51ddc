package me.christianrobert.detyper.transformer.env;

import java.util.Optional;

/**
 * Lookup of existential variables by number.
 */
public interface EvarStore {

    Optional<EvarInfo> lookup(int evarId);

    static EvarStore empty() {
        return evarId -> Optional.empty();
    }
}
