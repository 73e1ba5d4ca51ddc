package me.christianrobert.detyper.transformer.builder.cases;

import me.christianrobert.detyper.surface.CasesClause;
import me.christianrobert.detyper.surface.PatVar;
import me.christianrobert.detyper.surface.Pattern;
import me.christianrobert.detyper.transformer.context.DisplayOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

/**
 * Merges clauses with the same right-hand side and picks a default clause.
 *
 * <h3>Factorization</h3>
 * <p>Scanning backward, every earlier clause binding the same identifiers and
 * having an equal right-hand side is merged into the later one as extra
 * alternative rows, so a merged clause sits where its last member was. For
 * example {@code red => 1 | green => 0 | blue => 1} becomes
 * {@code green => 0 | red | blue => 1}.</p>
 *
 * <h3>Default clause</h3>
 * <p>Among identifier-free clauses with more than one row, the first one is
 * chosen, and then replaced by any later identifier-free clause with at least
 * as many rows, recursively. The chosen clause is removed and appended as a
 * single all-wildcard row. When no other clause is left, it keeps its first
 * row and gets a single wildcard row, so that a real constructor stays visible.</p>
 */
public class ClauseFactorizer {

    /**
     * Factorizes a clause list under the given options (identity in raw mode or with factorization off).
     */
    public List<CasesClause> factorize(List<CasesClause> clauses, DisplayOptions options) {
        if (options.isRaw() || !options.isFactorizeMatchPatterns()) {
            return clauses;
        }
        List<CasesClause> merged = merge(clauses);
        if (!options.isAllowMatchDefaultClause() || merged.isEmpty()) {
            return merged;
        }
        return withDefaultClause(merged);
    }

    /**
     * Merges equal clauses into their last occurrence.
     *
     * <p>Rows keep their original relative order inside the merged clause.</p>
     */
    public List<CasesClause> merge(List<CasesClause> clauses) {
        List<CasesClause> result = new ArrayList<>();
        boolean[] absorbed = new boolean[clauses.size()];
        for (int i = clauses.size() - 1; i >= 0; i--) {
            if (absorbed[i]) {
                continue;
            }
            CasesClause last = clauses.get(i);
            List<List<Pattern>> rows = new ArrayList<>(last.getRows());
            for (int j = i - 1; j >= 0; j--) {
                CasesClause candidate = clauses.get(j);
                if (!absorbed[j] && sameIds(last, candidate) && last.getRhs().equals(candidate.getRhs())) {
                    rows.addAll(0, candidate.getRows());
                    absorbed[j] = true;
                }
            }
            result.add(new CasesClause(last.getIds(), rows, last.getRhs()));
        }
        Collections.reverse(result);
        return result;
    }

    private List<CasesClause> withDefaultClause(List<CasesClause> clauses) {
        int first = -1;
        for (int i = 0; i < clauses.size(); i++) {
            if (isDefaultCandidate(clauses.get(i)) && clauses.get(i).getRows().size() > 1) {
                first = i;
                break;
            }
        }
        if (first < 0) {
            return clauses;
        }

        int best = first;
        int rows = clauses.get(first).getRows().size();
        for (int j = first + 1; j < clauses.size(); j++) {
            CasesClause candidate = clauses.get(j);
            if (isDefaultCandidate(candidate) && candidate.getRows().size() >= rows) {
                best = j;
                rows = candidate.getRows().size();
            }
        }

        CasesClause winner = clauses.get(best);
        List<CasesClause> remaining = new ArrayList<>(clauses);
        remaining.remove(best);
        List<Pattern> firstRow = winner.getRows().get(0);
        if (!remaining.isEmpty()) {
            remaining.add(CasesClause.single(List.of(), wildcards(firstRow.size()), winner.getRhs()));
            return remaining;
        }
        List<List<Pattern>> kept = List.of(firstRow, wildcards(winner.getRows().get(1).size()));
        return List.of(new CasesClause(List.of(), kept, winner.getRhs()));
    }

    private static boolean isDefaultCandidate(CasesClause clause) {
        return clause.getIds().isEmpty();
    }

    private static boolean sameIds(CasesClause a, CasesClause b) {
        return new HashSet<>(a.getIds()).equals(new HashSet<>(b.getIds()));
    }

    private static List<Pattern> wildcards(int count) {
        return new ArrayList<>(Collections.nCopies(count, PatVar.WILDCARD));
    }
}
