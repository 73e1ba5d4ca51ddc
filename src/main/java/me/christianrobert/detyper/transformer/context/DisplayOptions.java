package me.christianrobert.detyper.transformer.context;

import me.christianrobert.detyper.term.InductiveRef;

import java.util.Set;

/**
 * Immutable snapshot of the printing flags, taken once per detyping call.
 *
 * <p>Created by {@code ConfigService.snapshot()} in production and through
 * {@link #builder()} in tests. Defaults:</p>
 * <ul>
 *   <li>universes, primitive projection parameters, existential instances, fast names, raw: off</li>
 *   <li>wildcard, synth, matching, factorization, default clause: on</li>
 * </ul>
 */
public final class DisplayOptions {

    private final boolean printUniverses;
    private final boolean forceWildcard;
    private final boolean synthesizeReturnType;
    private final boolean reverseMatching;
    private final boolean printPrimitiveProjectionParameters;
    private final boolean factorizeMatchPatterns;
    private final boolean allowMatchDefaultClause;
    private final boolean fastNameGeneration;
    private final boolean printEvarArguments;
    private final boolean raw;
    private final Set<InductiveRef> ifStyleInductives;
    private final Set<InductiveRef> letStyleInductives;

    private DisplayOptions(Builder builder) {
        this.printUniverses = builder.printUniverses;
        this.forceWildcard = builder.forceWildcard;
        this.synthesizeReturnType = builder.synthesizeReturnType;
        this.reverseMatching = builder.reverseMatching;
        this.printPrimitiveProjectionParameters = builder.printPrimitiveProjectionParameters;
        this.factorizeMatchPatterns = builder.factorizeMatchPatterns;
        this.allowMatchDefaultClause = builder.allowMatchDefaultClause;
        this.fastNameGeneration = builder.fastNameGeneration;
        this.printEvarArguments = builder.printEvarArguments;
        this.raw = builder.raw;
        this.ifStyleInductives = Set.copyOf(builder.ifStyleInductives);
        this.letStyleInductives = Set.copyOf(builder.letStyleInductives);
    }

    public static DisplayOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isPrintUniverses() {
        return printUniverses;
    }

    public boolean isForceWildcard() {
        return forceWildcard;
    }

    public boolean isSynthesizeReturnType() {
        return synthesizeReturnType;
    }

    public boolean isReverseMatching() {
        return reverseMatching;
    }

    public boolean isPrintPrimitiveProjectionParameters() {
        return printPrimitiveProjectionParameters;
    }

    public boolean isFactorizeMatchPatterns() {
        return factorizeMatchPatterns;
    }

    public boolean isAllowMatchDefaultClause() {
        return allowMatchDefaultClause;
    }

    public boolean isFastNameGeneration() {
        return fastNameGeneration;
    }

    public boolean isPrintEvarArguments() {
        return printEvarArguments;
    }

    public boolean isRaw() {
        return raw;
    }

    public boolean isIfStyle(InductiveRef inductive) {
        return ifStyleInductives.contains(inductive);
    }

    public boolean isLetStyle(InductiveRef inductive) {
        return letStyleInductives.contains(inductive);
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.printUniverses = printUniverses;
        builder.forceWildcard = forceWildcard;
        builder.synthesizeReturnType = synthesizeReturnType;
        builder.reverseMatching = reverseMatching;
        builder.printPrimitiveProjectionParameters = printPrimitiveProjectionParameters;
        builder.factorizeMatchPatterns = factorizeMatchPatterns;
        builder.allowMatchDefaultClause = allowMatchDefaultClause;
        builder.fastNameGeneration = fastNameGeneration;
        builder.printEvarArguments = printEvarArguments;
        builder.raw = raw;
        builder.ifStyleInductives = ifStyleInductives;
        builder.letStyleInductives = letStyleInductives;
        return builder;
    }

    @Override
    public String toString() {
        return "DisplayOptions{" +
                "universes=" + printUniverses +
                ", wildcard=" + forceWildcard +
                ", synth=" + synthesizeReturnType +
                ", matching=" + reverseMatching +
                ", projParams=" + printPrimitiveProjectionParameters +
                ", factorize=" + factorizeMatchPatterns +
                ", defaultClause=" + allowMatchDefaultClause +
                ", fastNames=" + fastNameGeneration +
                ", evarArgs=" + printEvarArguments +
                ", raw=" + raw +
                '}';
    }

    public static final class Builder {
        private boolean printUniverses = false;
        private boolean forceWildcard = true;
        private boolean synthesizeReturnType = true;
        private boolean reverseMatching = true;
        private boolean printPrimitiveProjectionParameters = false;
        private boolean factorizeMatchPatterns = true;
        private boolean allowMatchDefaultClause = true;
        private boolean fastNameGeneration = false;
        private boolean printEvarArguments = false;
        private boolean raw = false;
        private Set<InductiveRef> ifStyleInductives = Set.of();
        private Set<InductiveRef> letStyleInductives = Set.of();

        private Builder() {
        }

        public Builder printUniverses(boolean value) {
            this.printUniverses = value;
            return this;
        }

        public Builder forceWildcard(boolean value) {
            this.forceWildcard = value;
            return this;
        }

        public Builder synthesizeReturnType(boolean value) {
            this.synthesizeReturnType = value;
            return this;
        }

        public Builder reverseMatching(boolean value) {
            this.reverseMatching = value;
            return this;
        }

        public Builder printPrimitiveProjectionParameters(boolean value) {
            this.printPrimitiveProjectionParameters = value;
            return this;
        }

        public Builder factorizeMatchPatterns(boolean value) {
            this.factorizeMatchPatterns = value;
            return this;
        }

        public Builder allowMatchDefaultClause(boolean value) {
            this.allowMatchDefaultClause = value;
            return this;
        }

        public Builder fastNameGeneration(boolean value) {
            this.fastNameGeneration = value;
            return this;
        }

        public Builder printEvarArguments(boolean value) {
            this.printEvarArguments = value;
            return this;
        }

        public Builder raw(boolean value) {
            this.raw = value;
            return this;
        }

        public Builder ifStyleInductives(Set<InductiveRef> inductives) {
            this.ifStyleInductives = inductives;
            return this;
        }

        public Builder letStyleInductives(Set<InductiveRef> inductives) {
            this.letStyleInductives = inductives;
            return this;
        }

        public DisplayOptions build() {
            return new DisplayOptions(this);
        }
    }
}
