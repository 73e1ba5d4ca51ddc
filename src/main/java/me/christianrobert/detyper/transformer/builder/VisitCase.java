package me.christianrobert.detyper.transformer.builder;

import me.christianrobert.detyper.surface.CasesClause;
import me.christianrobert.detyper.surface.CasesScrutinee;
import me.christianrobert.detyper.surface.GCases;
import me.christianrobert.detyper.surface.GIf;
import me.christianrobert.detyper.surface.GLetTuple;
import me.christianrobert.detyper.surface.SurfaceTerm;
import me.christianrobert.detyper.term.Case;
import me.christianrobert.detyper.term.CaseInfo;
import me.christianrobert.detyper.term.CaseStyle;
import me.christianrobert.detyper.term.InductiveRef;
import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.term.Terms;
import me.christianrobert.detyper.transformer.builder.cases.BranchDecomposer;
import me.christianrobert.detyper.transformer.builder.cases.CaseTreeReconstructor;
import me.christianrobert.detyper.transformer.builder.cases.ClauseFactorizer;
import me.christianrobert.detyper.transformer.builder.cases.NamedPrefix;
import me.christianrobert.detyper.transformer.builder.cases.ReturnClause;
import me.christianrobert.detyper.transformer.builder.cases.SurfacePatterns;
import me.christianrobert.detyper.transformer.context.DetypingFlags;
import me.christianrobert.detyper.transformer.context.DisplayOptions;
import me.christianrobert.detyper.transformer.context.NamingContext;
import me.christianrobert.detyper.transformer.naming.NameAvoidance;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Static helper for case expressions.
 *
 * <p>Picks the notation ({@code match}, {@code if} or a tuple {@code let}),
 * decides whether the return clause is shown and rebuilds the clause list,
 * using the nested case-tree when possible and one clause per constructor
 * otherwise.</p>
 */
public class VisitCase {

    public static SurfaceTerm v(Case term, DetypingFlags flags, NameAvoidance avoid, NamingContext names,
                                SurfaceTermBuilder b) {
        DisplayOptions options = b.getOptions();
        CaseInfo info = term.getInfo();
        InductiveRef inductive = info.getInductive();
        List<Term> branches = term.getBranches();

        SurfaceTerm scrutinee = b.build(term.getScrutinee(), flags, avoid, names);

        SurfaceTerm returnType = null;
        Name alias = Name.ANONYMOUS;
        List<Name> inNames = List.of();
        boolean inClause = false;
        if (showsReturnClause(term, options)) {
            SurfaceTerm predicate = b.build(term.getMotive(), flags, avoid, names);
            ReturnClause clause = SurfacePatterns.returnTypeOfPredicate(inductive, info.getInductiveTags(), predicate);
            returnType = clause.getType();
            alias = clause.getAlias();
            inNames = clause.getInNames();
            inClause = clause.hasInNames();
        }

        CaseStyle style = selectStyle(info, options, branches);
        if (!inClause && style == CaseStyle.LET && info.getConstructorCount() == 1) {
            SurfaceTerm branch = b.build(branches.get(0), flags, avoid, names);
            NamedPrefix prefix = SurfacePatterns.destLambdaOrLetInNames(info.getConstructorTags().get(0), branch);
            return new GLetTuple(prefix.getNames(), alias, returnType, scrutinee, prefix.getBody());
        }
        if (!inClause && style == CaseStyle.IF && info.getConstructorCount() == 2) {
            Optional<SurfaceTerm> thenBranch = SurfacePatterns.stripTaggedBinders(info.getConstructorTags().get(0),
                    b.build(branches.get(0), flags, avoid, names));
            Optional<SurfaceTerm> elseBranch = SurfacePatterns.stripTaggedBinders(info.getConstructorTags().get(1),
                    b.build(branches.get(1), flags, avoid, names));
            if (thenBranch.isPresent() && elseBranch.isPresent()) {
                return new GIf(scrutinee, alias, returnType, thenBranch.get(), elseBranch.get());
            }
            style = CaseStyle.REGULAR;
        }

        List<CasesClause> clauses = buildClauses(info, branches, flags, avoid, names, b);
        CasesScrutinee matched = new CasesScrutinee(scrutinee, alias, inClause ? inductive : null, inNames);
        return new GCases(style, returnType, List.of(matched), clauses);
    }

    /**
     * Checks that a motive is a constant function of its {@code k} real arguments and the matched value.
     */
    public static boolean isComputable(Term motive, int k) {
        return Terms.countLambdaOrLetIn(motive) == k + 1
                && Terms.noccurBetween(Terms.stripLambdaOrLetIn(motive), 1, k + 1);
    }

    private static boolean showsReturnClause(Case term, DisplayOptions options) {
        return options.isRaw()
                || !options.isSynthesizeReturnType()
                || term.getBranches().isEmpty()
                || !isComputable(term.getMotive(), term.getInfo().getInductiveTags().size());
    }

    private static CaseStyle selectStyle(CaseInfo info, DisplayOptions options, List<Term> branches) {
        if (options.isRaw()) {
            return CaseStyle.REGULAR;
        }
        if (info.getStyle() == CaseStyle.LET_PATTERN) {
            return CaseStyle.LET_PATTERN;
        }
        if (options.isIfStyle(info.getInductive()) && info.getConstructorCount() == 2) {
            return nonDependentBranches(info, branches) ? CaseStyle.IF : CaseStyle.REGULAR;
        }
        if (options.isLetStyle(info.getInductive()) && info.getConstructorCount() == 1) {
            return CaseStyle.LET;
        }
        if (info.getStyle() == CaseStyle.IF) {
            return nonDependentBranches(info, branches) ? CaseStyle.IF : CaseStyle.REGULAR;
        }
        return info.getStyle();
    }

    private static boolean nonDependentBranches(CaseInfo info, List<Term> branches) {
        for (int i = 0; i < branches.size(); i++) {
            if (!BranchDecomposer.isNonDependent(branches.get(i), info.getConstructorTags().get(i))) {
                return false;
            }
        }
        return true;
    }

    private static List<CasesClause> buildClauses(CaseInfo info, List<Term> branches, DetypingFlags flags,
                                                  NameAvoidance avoid, NamingContext names, SurfaceTermBuilder b) {
        DisplayOptions options = b.getOptions();
        BranchDecomposer decomposer = new BranchDecomposer(b);
        CaseTreeReconstructor reconstructor = new CaseTreeReconstructor(b, decomposer);
        boolean useTree = !options.isRaw() && options.isReverseMatching();

        List<CasesClause> clauses = new ArrayList<>();
        for (int i = 0; i < branches.size(); i++) {
            Term branch = branches.get(i);
            Optional<List<CasesClause>> fromTree = useTree
                    ? reconstructor.reconstructBranch(info, i, branch, flags, avoid, names)
                    : Optional.empty();
            if (fromTree.isPresent()) {
                clauses.addAll(fromTree.get());
            } else {
                clauses.add(decomposer.decomposeDirect(info.getInductive().constructor(i + 1),
                        info.getConstructorTags().get(i), branch, flags, avoid, names));
            }
        }
        return new ClauseFactorizer().factorize(clauses, options);
    }
}
