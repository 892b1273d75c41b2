package com.flamingo.richtext.service.editing;

import com.flamingo.richtext.domain.model.Run;
import java.util.List;

/**
 * Outcome of splitting one run.
 *
 * @param segments one entry per requested segment, in order; {@code null} where the segment was
 *     empty and therefore not materialized
 * @param primary the segment that inherited the original address, or {@code null} if it was empty
 */
public record SplitResult(List<Run> segments, Run primary) {}
