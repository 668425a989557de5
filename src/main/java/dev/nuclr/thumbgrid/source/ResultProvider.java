package dev.nuclr.thumbgrid.source;

import dev.nuclr.thumbgrid.ResultItem;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the ordered entries of a completed search. Item {@code i} of the
 * returned list must carry index {@code i}.
 */
public interface ResultProvider {

    List<ResultItem> results() throws IOException;
}
