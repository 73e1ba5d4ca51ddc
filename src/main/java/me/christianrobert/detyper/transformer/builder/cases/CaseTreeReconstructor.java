package me.christianrobert.detyper.transformer.builder.cases;

import me.christianrobert.detyper.surface.CasesClause;
import me.christianrobert.detyper.surface.PatCstr;
import me.christianrobert.detyper.surface.PatVar;
import me.christianrobert.detyper.surface.Pattern;
import me.christianrobert.detyper.term.Case;
import me.christianrobert.detyper.term.CaseInfo;
import me.christianrobert.detyper.term.ConstructorRef;
import me.christianrobert.detyper.term.Name;
import me.christianrobert.detyper.term.Term;
import me.christianrobert.detyper.term.Terms;
import me.christianrobert.detyper.transformer.builder.SurfaceTermBuilder;
import me.christianrobert.detyper.transformer.builder.VisitCase;
import me.christianrobert.detyper.transformer.context.DetypingFlags;
import me.christianrobert.detyper.transformer.context.NamingContext;
import me.christianrobert.detyper.transformer.naming.NameAvoidance;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Rebuilds nested patterns from a compiled case tree.
 *
 * <p>The pattern-matching compiler turns
 * <pre>
 * match l with
 * | cons x (cons y _) => a
 * | _ => b
 * end
 * </pre>
 * into a case on {@code l} whose {@code cons} branch immediately cases on its
 * second argument. Whenever a branch body is a case on one of the variables
 * the branch just bound (with a non-dependent motive), that inner case is
 * expanded into sub-patterns at the variable's position, recursively.</p>
 *
 * <p>Reconstruction works per branch of the outer case and reports
 * {@link Optional#empty()} when a branch does not have the expected shape; the
 * caller then decomposes that branch directly.</p>
 */
public class CaseTreeReconstructor {

    private final SurfaceTermBuilder builder;
    private final BranchDecomposer decomposer;

    public CaseTreeReconstructor(SurfaceTermBuilder builder, BranchDecomposer decomposer) {
        this.builder = builder;
        this.decomposer = decomposer;
    }

    /**
     * Reconstructs the clauses produced by one branch of a top-level case.
     *
     * @param info Case descriptor
     * @param index Branch position (0-based)
     * @param branch Branch body
     * @return translated clauses, or empty when the tree cannot be rebuilt
     */
    public Optional<List<CasesClause>> reconstructBranch(CaseInfo info, int index, Term branch,
                                                          DetypingFlags flags, NameAvoidance avoid,
                                                          NamingContext names) {
        Optional<List<TreeRow>> rows = contractBranch(info, index, Name.ANONYMOUS, flags,
                new BranchState(avoid, names, branch));
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        List<CasesClause> clauses = new ArrayList<>();
        for (TreeRow row : rows.get()) {
            BranchState rhs = row.rhs;
            clauses.add(CasesClause.single(new ArrayList<>(row.ids), row.patterns,
                    builder.build(rhs.getBody(), flags, rhs.getAvoidance(), rhs.getNames())));
        }
        return Optional.of(clauses);
    }

    private Optional<List<TreeRow>> buildTree(Name alias, CaseInfo info, List<Term> branches,
                                              DetypingFlags flags, NameAvoidance avoid, NamingContext names) {
        List<TreeRow> rows = new ArrayList<>();
        for (int i = 0; i < branches.size(); i++) {
            Optional<List<TreeRow>> contracted = contractBranch(info, i, alias, flags,
                    new BranchState(avoid, names, branches.get(i)));
            if (contracted.isEmpty()) {
                return Optional.empty();
            }
            rows.addAll(contracted.get());
        }
        return Optional.of(rows);
    }

    private Optional<List<TreeRow>> contractBranch(CaseInfo info, int index, Name alias,
                                                   DetypingFlags flags, BranchState state) {
        DecomposedBranch decomposed = decomposer.decompose(info.getConstructorTags().get(index), flags, state);
        Optional<List<TreeRow>> aligned = alignTree(decomposed.getNames(), flags, decomposed.getRest());
        if (aligned.isEmpty()) {
            return Optional.empty();
        }
        ConstructorRef constructor = info.getInductive().constructor(index + 1);
        List<TreeRow> rows = new ArrayList<>();
        for (TreeRow row : aligned.get()) {
            Optional<Name> shownAlias = updateName(alias, row.rhs);
            if (shownAlias.isEmpty()) {
                return Optional.empty();
            }
            Set<String> ids = new TreeSet<>(row.ids);
            addName(ids, shownAlias.get());
            rows.add(new TreeRow(ids, List.of(new PatCstr(constructor, row.patterns, shownAlias.get())), row.rhs));
        }
        return Optional.of(rows);
    }

    private Optional<List<TreeRow>> alignTree(List<Name> pending, DetypingFlags flags, BranchState rhs) {
        if (pending.isEmpty()) {
            return Optional.of(List.of(new TreeRow(new TreeSet<>(), List.of(), rhs)));
        }
        Name name = pending.get(0);
        List<Name> rest = pending.subList(1, pending.size());
        Term c = rhs.getBody();

        if (c instanceof Case) {
            Case nested = (Case) c;
            int rel = rhs.getNames().indexOf(name);
            if (rel < 0) {
                return Optional.empty();
            }
            if (nested.getScrutinee().equals(Terms.mkRel(rel))
                    && !nested.getBranches().isEmpty()
                    && VisitCase.isComputable(nested.getMotive(), nested.getInfo().getInductiveTags().size())) {
                Optional<List<TreeRow>> clauses = buildTree(name, nested.getInfo(), nested.getBranches(), flags,
                        rhs.getAvoidance(), rhs.getNames());
                if (clauses.isEmpty()) {
                    return Optional.empty();
                }
                List<TreeRow> rows = new ArrayList<>();
                for (TreeRow clause : clauses.get()) {
                    Optional<List<TreeRow>> lines = alignTree(rest, flags, clause.rhs);
                    if (lines.isEmpty()) {
                        return Optional.empty();
                    }
                    for (TreeRow line : lines.get()) {
                        Set<String> ids = new TreeSet<>(clause.ids);
                        ids.addAll(line.ids);
                        rows.add(new TreeRow(ids, prepend(clause.patterns.get(0), line.patterns), line.rhs));
                    }
                }
                return Optional.of(rows);
            }
        }

        Optional<Name> shown = updateName(name, rhs);
        if (shown.isEmpty()) {
            return Optional.empty();
        }
        Optional<List<TreeRow>> lines = alignTree(rest, flags, rhs);
        if (lines.isEmpty()) {
            return Optional.empty();
        }
        List<TreeRow> rows = new ArrayList<>();
        for (TreeRow line : lines.get()) {
            Set<String> ids = new TreeSet<>(line.ids);
            addName(ids, shown.get());
            rows.add(new TreeRow(ids, prepend(new PatVar(shown.get()), line.patterns), line.rhs));
        }
        return Optional.of(rows);
    }

    /**
     * Wildcard promotion: a named pattern variable unused in the right-hand side becomes {@code _}
     * when wildcards are forced.
     *
     * @return the name to display, or empty when the name is not bound in the right-hand side's context
     */
    Optional<Name> updateName(Name name, BranchState rhs) {
        if (name.isAnonymous() || !builder.getOptions().isForceWildcard()) {
            return Optional.of(name);
        }
        int rel = rhs.getNames().indexOf(name);
        if (rel < 0) {
            return Optional.empty();
        }
        return Optional.of(Terms.noccurn(rel, rhs.getBody()) ? Name.ANONYMOUS : name);
    }

    private static List<Pattern> prepend(Pattern head, List<Pattern> tail) {
        List<Pattern> result = new ArrayList<>(tail.size() + 1);
        result.add(head);
        result.addAll(tail);
        return result;
    }

    private static void addName(Set<String> ids, Name name) {
        if (name.isNamed()) {
            ids.add(name.getId());
        }
    }

    /**
     * Partial clause: bound identifiers, pattern columns and the right-hand side still to translate.
     */
    private static class TreeRow {
        private final Set<String> ids;
        private final List<Pattern> patterns;
        private final BranchState rhs;

        TreeRow(Set<String> ids, List<Pattern> patterns, BranchState rhs) {
            this.ids = ids;
            this.patterns = patterns;
            this.rhs = rhs;
        }
    }
}
