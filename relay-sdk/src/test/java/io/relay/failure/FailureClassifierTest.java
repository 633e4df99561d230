package io.relay.failure;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.concurrent.CancellationException;
import org.junit.Test;

public class FailureClassifierTest {

  @Test
  public void cancellations() {
    assertTrue(FailureClassifier.isCancellation(new CanceledFailure()));
    assertTrue(FailureClassifier.isCancellation(new CancellationException()));
    assertTrue(FailureClassifier.isCancellation(activityFailure(new CanceledFailure())));
    assertTrue(FailureClassifier.isCancellation(childWorkflowFailure(new CanceledFailure())));
  }

  @Test
  public void notCancellations() {
    assertFalse(FailureClassifier.isCancellation(null));
    assertFalse(FailureClassifier.isCancellation(new RuntimeException("boom")));
    assertFalse(FailureClassifier.isCancellation(ApplicationFailure.newFailure("m", "T")));
    assertFalse(FailureClassifier.isCancellation(new TerminatedFailure("killed")));
    assertFalse(FailureClassifier.isCancellation(activityFailure(null)));
    assertFalse(
        FailureClassifier.isCancellation(
            activityFailure(ApplicationFailure.newFailure("m", "T"))));
  }

  @Test
  public void onlyDirectCauseIsExamined() {
    ActivityFailure nested = activityFailure(activityFailure(new CanceledFailure()));
    assertFalse(FailureClassifier.isCancellation(nested));

    ChildWorkflowFailure throughChild =
        childWorkflowFailure(activityFailure(new CanceledFailure()));
    assertFalse(FailureClassifier.isCancellation(throughChild));
  }

  @Test
  public void canceledCauseOfOtherFailureIsNotCancellation() {
    ApplicationFailure failure =
        ApplicationFailure.newFailureWithCause("m", "T", new CanceledFailure());
    assertFalse(FailureClassifier.isCancellation(failure));
    RuntimeException wrapped = new RuntimeException(new CancellationException());
    assertFalse(FailureClassifier.isCancellation(wrapped));
  }

  private static ActivityFailure activityFailure(Throwable cause) {
    return new ActivityFailure(
        "activity error", 1, 2, "Activity", "1", "identity", RetryState.CANCEL_REQUESTED, cause);
  }

  private static ChildWorkflowFailure childWorkflowFailure(Throwable cause) {
    return new ChildWorkflowFailure(
        "child error", "default", "wid", "rid", "Child", 3, 4, RetryState.CANCEL_REQUESTED, cause);
  }
}
