package com.mk.fx.qa.boundary.analysis.stats;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.DoubleStream;

/**
 * Ordered, immutable sequence of raw samples collected for one (variant, condition, metric).
 *
 * <p>Samples are appended through a {@link Builder} while a measurement round is in progress;
 * {@link Builder#build()} freezes the round. A new round always produces a new instance.
 */
public final class SampleSet {

  private static final SampleSet EMPTY = new SampleSet(new double[0]);

  private final double[] values;

  private SampleSet(double[] values) {
    this.values = values;
  }

  public static SampleSet empty() {
    return EMPTY;
  }

  public static SampleSet of(double... values) {
    Builder builder = builder();
    for (double v : values) {
      builder.add(v);
    }
    return builder.build();
  }

  public static SampleSet of(Collection<? extends Number> values) {
    Builder builder = builder();
    for (Number v : values) {
      if (v == null) {
        throw new IllegalArgumentException("Sample values must not be null");
      }
      builder.add(v.doubleValue());
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public int size() {
    return values.length;
  }

  public boolean isEmpty() {
    return values.length == 0;
  }

  public double get(int index) {
    return values[index];
  }

  /** Returns a copy of the samples in recording order. */
  public double[] toArray() {
    return values.clone();
  }

  public DoubleStream stream() {
    return Arrays.stream(values);
  }

  public List<Double> asList() {
    return stream().boxed().collect(Collectors.toUnmodifiableList());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SampleSet other)) return false;
    return Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    return Arrays.toString(values);
  }

  /** Append-only accumulator for a single measurement round. Not thread-safe. */
  public static final class Builder {
    private double[] buffer = new double[8];
    private int size;

    private Builder() {}

    public Builder add(double sample) {
      if (!Double.isFinite(sample)) {
        throw new IllegalArgumentException("Sample must be a finite number but was " + sample);
      }
      if (size == buffer.length) {
        buffer = Arrays.copyOf(buffer, size * 2);
      }
      buffer[size++] = sample;
      return this;
    }

    public int size() {
      return size;
    }

    public SampleSet build() {
      return size == 0 ? EMPTY : new SampleSet(Arrays.copyOf(buffer, size));
    }
  }
}
