package me.christianrobert.detyper.transformer.builder.cases;

import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.transformer.context.NamingContext;
import me.christianrobert.detyper.transformer.naming.NameAvoidance;

/**
 * Remaining core body of a branch with the naming state it must be translated in.
 */
public final class BranchState {

    private final NameAvoidance avoidance;
    private final NamingContext names;
    private final Term body;

    public BranchState(NameAvoidance avoidance, NamingContext names, Term body) {
        this.avoidance = avoidance;
        this.names = names;
        this.body = body;
    }

    public NameAvoidance getAvoidance() {
        return avoidance;
    }

    public NamingContext getNames() {
        return names;
    }

    public Term getBody() {
        return body;
    }
}
