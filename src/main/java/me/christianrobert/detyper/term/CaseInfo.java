package me.christianrobert.detyper.term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Printing metadata attached to a case expression.
 *
 * <p>The constructor tags list, for each constructor, one flag per argument
 * slot of the branch: {@code true} when the slot is a let-bound (defined)
 * argument, {@code false} for an ordinary lambda-bound one. The inductive tags
 * describe the real arguments (indices) of the inductive type, i.e. the
 * binders the motive abstracts over before the matched value itself.</p>
 *
 * <p>Example for {@code list A} with constructors {@code nil} and
 * {@code cons : A -> list A -> list A}:</p>
 * <pre>
 * constructorTags = [[], [false, false]]
 * inductiveTags   = []
 * </pre>
 */
public class CaseInfo {

    private final InductiveRef inductive;
    private final CaseStyle style;
    private final List<List<Boolean>> constructorTags;
    private final List<Boolean> inductiveTags;

    public CaseInfo(InductiveRef inductive,
                    CaseStyle style,
                    List<List<Boolean>> constructorTags,
                    List<Boolean> inductiveTags) {
        this.inductive = Objects.requireNonNull(inductive, "inductive");
        this.style = Objects.requireNonNull(style, "style");
        List<List<Boolean>> tags = new ArrayList<>();
        for (List<Boolean> constructor : constructorTags) {
            tags.add(List.copyOf(constructor));
        }
        this.constructorTags = Collections.unmodifiableList(tags);
        this.inductiveTags = List.copyOf(inductiveTags);
    }

    /**
     * Shortcut for a regular case whose constructors take only lambda-bound
     * arguments and whose inductive has no indices.
     *
     * @param inductive Matched inductive
     * @param arities Number of arguments of each constructor
     */
    public static CaseInfo regular(InductiveRef inductive, int... arities) {
        List<List<Boolean>> tags = new ArrayList<>();
        for (int arity : arities) {
            tags.add(Collections.nCopies(arity, Boolean.FALSE));
        }
        return new CaseInfo(inductive, CaseStyle.REGULAR, tags, List.of());
    }

    public InductiveRef getInductive() {
        return inductive;
    }

    public CaseStyle getStyle() {
        return style;
    }

    public List<List<Boolean>> getConstructorTags() {
        return constructorTags;
    }

    public List<Boolean> getInductiveTags() {
        return inductiveTags;
    }

    public int getConstructorCount() {
        return constructorTags.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CaseInfo caseInfo = (CaseInfo) o;
        return inductive.equals(caseInfo.inductive) && style == caseInfo.style
                && constructorTags.equals(caseInfo.constructorTags)
                && inductiveTags.equals(caseInfo.inductiveTags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inductive, style, constructorTags, inductiveTags);
    }

    @Override
    public String toString() {
        return "CaseInfo{" + inductive + ", " + style + ", tags=" + constructorTags + "}";
    }
}
