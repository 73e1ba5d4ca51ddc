package me.christianrobert.detyper.transformer.builder.cases;

import me.christianrobert.detyper.surface.CasesClause;
import me.christianrobert.detyper.surface.GApp;
import me.christianrobert.detyper.surface.GLambda;
import me.christianrobert.detyper.surface.GLetIn;
import me.christianrobert.detyper.surface.GVar;
import me.christianrobert.detyper.surface.PatCstr;
import me.christianrobert.detyper.surface.PatVar;
import me.christianrobert.detyper.surface.Pattern;
import me.christianrobert.detyper.surface.SurfaceTerm;
import me.christianrobert.detyper.surface.SurfaceTerms;
import me.christianrobert.detyper.term.InductiveRef;
import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.transformer.naming.BinderRole;
import me.christianrobert.detyper.transformer.naming.Subscripts;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads pattern information back from already translated surface terms.
 */
public final class SurfacePatterns {

    private SurfacePatterns() {
    }

    /**
     * Reads one binder name per tag off the front of {@code term}.
     *
     * <p>A lambda answers a {@code false} tag and a let answers a {@code true}
     * tag. A missing let slot is anonymous; a missing lambda slot is
     * eta-expanded by applying the term to a fresh {@code x}.</p>
     */
    public static NamedPrefix destLambdaOrLetInNames(List<Boolean> tags, SurfaceTerm term) {
        List<Name> names = new ArrayList<>();
        SurfaceTerm c = term;
        for (Boolean letSlot : tags) {
            if (c instanceof GLambda && !letSlot) {
                names.add(((GLambda) c).getName());
                c = ((GLambda) c).getBody();
            } else if (c instanceof GLetIn && letSlot) {
                names.add(((GLetIn) c).getName());
                c = ((GLetIn) c).getBody();
            } else if (letSlot) {
                names.add(Name.ANONYMOUS);
            } else {
                String x = freshVariable(SurfaceTerms.freeVariables(c));
                names.add(Name.of(x));
                c = SurfaceTerms.mkApp(c, List.of(new GVar(x)));
            }
        }
        return new NamedPrefix(names, c);
    }

    /**
     * Strips exactly the tagged binders of a translated branch.
     *
     * @return the remaining body, or empty when the branch does not start with those binders
     */
    public static Optional<SurfaceTerm> stripTaggedBinders(List<Boolean> tags, SurfaceTerm term) {
        SurfaceTerm c = term;
        for (Boolean letSlot : tags) {
            if (c instanceof GLambda && !letSlot) {
                c = ((GLambda) c).getBody();
            } else if (c instanceof GLetIn && letSlot) {
                c = ((GLetIn) c).getBody();
            } else {
                return Optional.empty();
            }
        }
        return Optional.of(c);
    }

    /**
     * Turns translated branch bodies into one simple clause per constructor.
     *
     * @param inductive Matched inductive
     * @param tags Argument tags of each constructor
     * @param branches Translated branch bodies, in constructor order
     */
    public static List<CasesClause> simpleCasesMatrixOfBranches(InductiveRef inductive, List<List<Boolean>> tags,
                                                                List<SurfaceTerm> branches) {
        if (tags.size() != branches.size()) {
            throw new IllegalArgumentException("Expected one tag list per branch, got "
                    + tags.size() + " for " + branches.size() + " branches");
        }
        List<CasesClause> clauses = new ArrayList<>();
        for (int i = 0; i < branches.size(); i++) {
            NamedPrefix prefix = destLambdaOrLetInNames(tags.get(i), branches.get(i));
            List<Pattern> arguments = new ArrayList<>();
            Set<String> ids = new TreeSet<>();
            for (Name name : prefix.getNames()) {
                arguments.add(new PatVar(name));
                if (name.isNamed()) {
                    ids.add(name.getId());
                }
            }
            Pattern pattern = new PatCstr(inductive.constructor(i + 1), arguments, Name.ANONYMOUS);
            clauses.add(CasesClause.single(new ArrayList<>(ids), List.of(pattern), prefix.getBody()));
        }
        return clauses;
    }

    /**
     * Splits a translated motive {@code fun (indices..) (x : I indices) => T} into its return clause.
     *
     * @param inductive Matched inductive
     * @param realArgTags Tags of the inductive's real arguments
     * @param predicate Translated motive
     */
    public static ReturnClause returnTypeOfPredicate(InductiveRef inductive, List<Boolean> realArgTags,
                                                     SurfaceTerm predicate) {
        List<Boolean> tags = new ArrayList<>(realArgTags);
        tags.add(Boolean.FALSE);
        NamedPrefix prefix = destLambdaOrLetInNames(tags, predicate);
        List<Name> names = prefix.getNames();
        Name alias = names.get(names.size() - 1);
        return new ReturnClause(alias, inductive, names.subList(0, names.size() - 1), prefix.getBody());
    }

    static String freshVariable(Set<String> taken) {
        String x = BinderRole.DEPENDENT_STEM;
        while (taken.contains(x)) {
            x = Subscripts.increment(x);
        }
        return x;
    }
}
