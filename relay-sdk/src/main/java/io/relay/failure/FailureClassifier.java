package io.relay.failure;

import java.util.concurrent.CancellationException;
import javax.annotation.Nullable;

/** Predicates over exceptions thrown by workflow and activity code. */
public final class FailureClassifier {
  private FailureClassifier() {}

  /**
   * Checks if an exception represents a cancellation. Usually used in a catch block of workflow
   * code to tell a cancellation apart from a failure.
   *
   * <p>Returns true for a {@link CancellationException}, a {@link CanceledFailure}, or an {@link
   * ActivityFailure} or {@link ChildWorkflowFailure} whose direct cause is a {@link
   * CanceledFailure}. Only one level of wrapping is looked through: an activity failure caused by
   * another activity failure is not a cancellation of this workflow even if a cancellation is
   * deeper in the chain.
   *
   * @param e exception to check, may be null
   * @return true if {@code e} represents a cancellation
   */
  public static boolean isCancellation(@Nullable Throwable e) {
    if (e instanceof CancellationException || e instanceof CanceledFailure) {
      return true;
    }
    return (e instanceof ActivityFailure || e instanceof ChildWorkflowFailure)
        && e.getCause() instanceof CanceledFailure;
  }
}
