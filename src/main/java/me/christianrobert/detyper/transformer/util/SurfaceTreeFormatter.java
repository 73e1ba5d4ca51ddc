package me.christianrobert.detyper.transformer.util;

import me.christianrobert.detyper.surface.CasesClause;
import me.christianrobert.detyper.surface.CasesScrutinee;
import me.christianrobert.detyper.surface.EvarArgument;
import me.christianrobert.detyper.surface.GApp;
import me.christianrobert.detyper.surface.GBinderTerm;
import me.christianrobert.detyper.surface.GCases;
import me.christianrobert.detyper.surface.GCast;
import me.christianrobert.detyper.surface.GEvar;
import me.christianrobert.detyper.surface.GIf;
import me.christianrobert.detyper.surface.GLetIn;
import me.christianrobert.detyper.surface.GLetTuple;
import me.christianrobert.detyper.surface.GRec;
import me.christianrobert.detyper.surface.Pattern;
import me.christianrobert.detyper.surface.SurfaceBinder;
import me.christianrobert.detyper.surface.SurfaceTerm;

import java.util.List;

/**
 * Formats surface terms into an indented text tree, one node per line.
 *
 * <p>Used for trace logging of detyping results.</p>
 *
 * <p>Example output for {@code fun (n : nat) => match n with O => true | S _ => false end}:</p>
 * <pre>
 * LAMBDA n
 *   type: Coq.Init.Datatypes.nat
 *   CASES REGULAR
 *     scrutinee: n
 *     clause [(Coq.Init.Datatypes.nat.1)]
 *       Coq.Init.Datatypes.bool.1
 *     clause [(Coq.Init.Datatypes.nat.2 _)]
 *       Coq.Init.Datatypes.bool.2
 * </pre>
 */
public class SurfaceTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a surface term into human-readable text.
   *
   * @param term Root of the surface tree
   * @return Formatted string representation
   */
  public static String format(SurfaceTerm term) {
    if (term == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(term, 0, sb);
    return sb.toString();
  }

  private static void formatNode(SurfaceTerm term, int depth, StringBuilder sb) {
    switch (term.getKind()) {
      case APP: {
        GApp app = (GApp) term;
        line(sb, depth, "APP");
        formatNode(app.getHead(), depth + 1, sb);
        for (SurfaceTerm arg : app.getArguments()) {
          formatNode(arg, depth + 1, sb);
        }
        break;
      }
      case PROD:
      case LAMBDA: {
        GBinderTerm binder = (GBinderTerm) term;
        line(sb, depth, term.getKind() + " " + binder.getName());
        labelled(sb, depth + 1, "type", binder.getType());
        formatNode(binder.getBody(), depth + 1, sb);
        break;
      }
      case LET_IN: {
        GLetIn let = (GLetIn) term;
        line(sb, depth, "LET_IN " + let.getName());
        labelled(sb, depth + 1, "value", let.getValue());
        if (let.getType() != null) {
          labelled(sb, depth + 1, "type", let.getType());
        }
        formatNode(let.getBody(), depth + 1, sb);
        break;
      }
      case CASES: {
        GCases cases = (GCases) term;
        line(sb, depth, "CASES " + cases.getStyle());
        for (CasesScrutinee scrutinee : cases.getScrutinees()) {
          labelled(sb, depth + 1, "scrutinee", scrutinee.getTerm());
          if (scrutinee.getAlias().isNamed() || scrutinee.hasInClause()) {
            line(sb, depth + 2, "as " + scrutinee.getAlias()
                + (scrutinee.hasInClause() ? " in " + scrutinee.getInInductive() + " " + scrutinee.getInNames() : ""));
          }
        }
        if (cases.getReturnType() != null) {
          labelled(sb, depth + 1, "return", cases.getReturnType());
        }
        for (CasesClause clause : cases.getClauses()) {
          line(sb, depth + 1, "clause " + rows(clause.getRows()));
          formatNode(clause.getRhs(), depth + 2, sb);
        }
        break;
      }
      case LET_TUPLE: {
        GLetTuple let = (GLetTuple) term;
        line(sb, depth, "LET_TUPLE " + let.getNames());
        labelled(sb, depth + 1, "scrutinee", let.getScrutinee());
        if (let.getReturnType() != null) {
          labelled(sb, depth + 1, "return", let.getReturnType());
        }
        formatNode(let.getBody(), depth + 1, sb);
        break;
      }
      case IF: {
        GIf gif = (GIf) term;
        line(sb, depth, "IF");
        labelled(sb, depth + 1, "scrutinee", gif.getScrutinee());
        if (gif.getReturnType() != null) {
          labelled(sb, depth + 1, "return", gif.getReturnType());
        }
        labelled(sb, depth + 1, "then", gif.getThenBranch());
        labelled(sb, depth + 1, "else", gif.getElseBranch());
        break;
      }
      case REC: {
        GRec rec = (GRec) term;
        line(sb, depth, rec.getRecKind() + " " + rec.getNames().get(rec.getIndex()));
        for (int i = 0; i < rec.getNames().size(); i++) {
          StringBuilder header = new StringBuilder(rec.getNames().get(i));
          for (SurfaceBinder binder : rec.getBinders().get(i)) {
            header.append(' ').append(binder.getName());
          }
          line(sb, depth + 1, header.toString());
          labelled(sb, depth + 2, "type", rec.getTypes().get(i));
          formatNode(rec.getBodies().get(i), depth + 2, sb);
        }
        break;
      }
      case EVAR: {
        GEvar evar = (GEvar) term;
        line(sb, depth, "EVAR ?" + evar.getId());
        for (EvarArgument arg : evar.getArguments()) {
          labelled(sb, depth + 1, arg.getId(), arg.getValue());
        }
        break;
      }
      case CAST: {
        GCast cast = (GCast) term;
        line(sb, depth, "CAST " + cast.getCastKind());
        formatNode(cast.getTerm(), depth + 1, sb);
        labelled(sb, depth + 1, "type", cast.getType());
        break;
      }
      default:
        // leaves
        line(sb, depth, escapeAndTruncate(term.toString()));
    }
  }

  private static void labelled(StringBuilder sb, int depth, String label, SurfaceTerm term) {
    if (isLeaf(term)) {
      line(sb, depth, label + ": " + escapeAndTruncate(term.toString()));
    } else {
      line(sb, depth, label + ":");
      formatNode(term, depth + 1, sb);
    }
  }

  private static boolean isLeaf(SurfaceTerm term) {
    switch (term.getKind()) {
      case VAR:
      case REF:
      case SORT:
      case HOLE:
      case INT:
      case FLOAT:
        return true;
      default:
        return false;
    }
  }

  private static String rows(List<List<Pattern>> rows) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < rows.size(); i++) {
      if (i > 0) {
        sb.append(" | ");
      }
      sb.append(rows.get(i));
    }
    return escapeAndTruncate(sb.toString());
  }

  private static void line(StringBuilder sb, int depth, String text) {
    for (int i = 0; i < depth; i++) {
      sb.append(INDENT);
    }
    sb.append(text).append("\n");
  }

  private static String escapeAndTruncate(String text) {
    if (text == null) {
      return "";
    }
    text = text.replace("\n", "\\n")
               .replace("\t", "\\t");
    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }
    return text;
  }
}
