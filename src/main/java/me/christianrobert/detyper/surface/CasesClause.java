package me.christianrobert.detyper.surface;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Disjunctive match clause {@code | row1 | row2 => rhs}.
 *
 * <p>{@code ids} is the sorted list of identifiers bound by the patterns;
 * every row holds one pattern per scrutinee.</p>
 */
public final class CasesClause {

    private final List<String> ids;
    private final List<List<Pattern>> rows;
    private final SurfaceTerm rhs;

    public CasesClause(List<String> ids, List<List<Pattern>> rows, SurfaceTerm rhs) {
        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Clause requires at least one pattern row");
        }
        this.ids = List.copyOf(ids);
        List<List<Pattern>> copy = new ArrayList<>();
        for (List<Pattern> row : rows) {
            copy.add(List.copyOf(row));
        }
        this.rows = List.copyOf(copy);
        this.rhs = Objects.requireNonNull(rhs, "rhs");
    }

    public static CasesClause single(List<String> ids, List<Pattern> row, SurfaceTerm rhs) {
        return new CasesClause(ids, List.of(row), rhs);
    }

    public List<String> getIds() {
        return ids;
    }

    public List<List<Pattern>> getRows() {
        return rows;
    }

    public SurfaceTerm getRhs() {
        return rhs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CasesClause that = (CasesClause) o;
        return ids.equals(that.ids) && rows.equals(that.rows) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ids, rows, rhs);
    }

    @Override
    public String toString() {
        return ids + " " + rows + " => " + rhs;
    }
}
