package com.cario.cert.app.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a single pipeline stage: either a value or a {@link PipelineFailure}.
 *
 * <p>Stages never throw past the orchestrator; callers branch on {@link #isSuccess()} and hand
 * failures to the HTTP boundary unchanged.
 *
 * @param <T> type of the success payload
 */
public final class StageResult<T> {

  private final T value;
  private final PipelineFailure failure;

  private StageResult(T value, PipelineFailure failure) {
    this.value = value;
    this.failure = failure;
  }

  public static <T> StageResult<T> success(T value) {
    return new StageResult<>(Objects.requireNonNull(value, "value must not be null"), null);
  }

  public static <T> StageResult<T> failure(PipelineFailure failure) {
    return new StageResult<>(null, Objects.requireNonNull(failure, "failure must not be null"));
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public boolean isFailure() {
    return failure != null;
  }

  /** @throws IllegalStateException if this result is a failure */
  public T getValue() {
    if (failure != null) {
      throw new IllegalStateException("No value: stage " + failure.stage() + " failed");
    }
    return value;
  }

  /** @throws IllegalStateException if this result is a success */
  public PipelineFailure getFailure() {
    if (failure == null) {
      throw new IllegalStateException("No failure: result is a success");
    }
    return failure;
  }

  public <R> StageResult<R> map(Function<? super T, ? extends R> fn) {
    return isSuccess() ? success(fn.apply(value)) : failure(failure);
  }

  /** Re-types a failed result so it can be returned from a stage with a different payload. */
  public <R> StageResult<R> propagate() {
    return failure(getFailure());
  }

  @Override
  public String toString() {
    return isSuccess() ? "StageResult[success=" + value + "]" : "StageResult[" + failure + "]";
  }
}
