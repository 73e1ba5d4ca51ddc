package me.christianrobert.detyper.transformer.builder;

import me.christianrobert.detyper.surface.GSort;
import me.christianrobert.detyper.surface.GSortLevel;
import me.christianrobert.detyper.term.Sort;
import me.christianrobert.detyper.term.SortFamily;
import me.christianrobert.detyper.term.UniverseLevel;
import me.christianrobert.detyper.transformer.context.DisplayOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Static helper for sorts. {@code Type} levels are shown only when universes are printed.
 */
public class VisitSort {

  public static GSort v(Sort sort, DisplayOptions options) {
    switch (sort.getFamily()) {
      case SPROP:
        return GSort.SPROP;
      case PROP:
        return GSort.PROP;
      case SET:
        return GSort.SET;
      default:
        break;
    }
    if (!options.isPrintUniverses()) {
      return GSort.ANONYMOUS_TYPE;
    }
    List<GSortLevel> levels = new ArrayList<>();
    for (UniverseLevel level : sort.getUniverse()) {
      levels.add(new GSortLevel(level.getLevel(), level.getIncrement()));
    }
    return new GSort(SortFamily.TYPE, levels);
  }
}
