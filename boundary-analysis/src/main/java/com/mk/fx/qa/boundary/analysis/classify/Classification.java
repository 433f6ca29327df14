package com.mk.fx.qa.boundary.analysis.classify;

import com.mk.fx.qa.boundary.analysis.model.BoundaryType;
import java.util.Objects;
import java.util.Optional;

/**
 * @param superior side with the better mean, null for {@code NOT_SIGNIFICANT} or an exact tie
 * @param relativeDiffPct {@code (a - b) / |b| * 100}
 */
public record Classification(BoundaryType boundaryType, Side superior, double relativeDiffPct) {

  public Classification {
    Objects.requireNonNull(boundaryType, "boundaryType");
  }

  public Optional<Side> superiorSide() {
    return Optional.ofNullable(superior);
  }
}
