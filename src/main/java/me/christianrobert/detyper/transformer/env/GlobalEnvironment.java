package me.christianrobert.detyper.transformer.env;

import me.christianrobert.detyper.term.ConstructorRef;
import me.christianrobert.detyper.term.InductiveRef;

import java.util.Optional;

/**
 * Read-only view of the global symbol table needed for display.
 *
 * <p>The detyper only asks for short names (to keep binder names from
 * shadowing the globals a body mentions), constructor counts and whether a
 * named variable is a section variable.</p>
 *
 * @see GlobalIndex
 */
public interface GlobalEnvironment {

    Optional<InductiveDeclaration> lookupInductive(InductiveRef inductive);

    /**
     * Checks whether {@code id} names a section variable (displayed as a global reference).
     */
    boolean isSectionVariable(String id);

    /**
     * Short (unqualified) name of a constant, e.g. {@code add} for {@code Coq.Init.Nat.add}.
     */
    default String constantShortName(String constant) {
        int dot = constant.lastIndexOf('.');
        return dot < 0 ? constant : constant.substring(dot + 1);
    }

    default Optional<String> inductiveShortName(InductiveRef inductive) {
        return lookupInductive(inductive).map(InductiveDeclaration::getName);
    }

    default Optional<String> constructorShortName(ConstructorRef constructor) {
        return lookupInductive(constructor.getInductive())
                .filter(decl -> constructor.getNumber() <= decl.getConstructorCount())
                .map(decl -> decl.getConstructorNames().get(constructor.getNumber() - 1));
    }
}
