package eventsource.middleware;

import eventsource.handler.ErrorClassifier;
import eventsource.handler.HandlerResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Immutable ordered composition of {@link EventMiddleware} stages around a terminal
 * handler call.
 *
 * <p>For stages {@code [A, B]} an invocation runs {@code A(B(terminal))}. A
 * {@link RuntimeException} escaping any stage or the terminal is classified and returned
 * as a {@link HandlerResult.Failure}, so nothing is thrown past the pipeline boundary.
 */
public final class MiddlewarePipeline {
  private static final Logger logger = Logger.getLogger(MiddlewarePipeline.class.getName());
  private static final MiddlewarePipeline EMPTY = new MiddlewarePipeline(List.of(), ErrorClassifier.DEFAULT);

  private final List<EventMiddleware> stages;
  private final ErrorClassifier classifier;

  private MiddlewarePipeline(List<EventMiddleware> stages, ErrorClassifier classifier) {
    this.stages = List.copyOf(stages);
    this.classifier = Objects.requireNonNull(classifier, "classifier");
  }

  public static MiddlewarePipeline empty() {
    return EMPTY;
  }

  public static MiddlewarePipeline of(EventMiddleware... stages) {
    return new MiddlewarePipeline(List.of(stages), ErrorClassifier.DEFAULT);
  }

  public static MiddlewarePipeline of(List<EventMiddleware> stages, ErrorClassifier classifier) {
    return new MiddlewarePipeline(stages, classifier);
  }

  /**
   * Returns a new pipeline with {@code stage} appended as the innermost stage.
   */
  public MiddlewarePipeline with(EventMiddleware stage) {
    Objects.requireNonNull(stage, "stage");
    List<EventMiddleware> copy = new ArrayList<>(stages);
    copy.add(stage);
    return new MiddlewarePipeline(copy, classifier);
  }

  public List<EventMiddleware> stages() {
    return stages;
  }

  /**
   * Runs {@code context} through every stage and then {@code terminal}.
   */
  public HandlerResult execute(HandlerContext context, EventMiddleware.Next terminal) {
    Objects.requireNonNull(terminal, "terminal");
    return guarded(0, terminal).proceed(context);
  }

  private EventMiddleware.Next guarded(int index, EventMiddleware.Next terminal) {
    return ctx -> {
      try {
        if (index == stages.size()) {
          return terminal.proceed(ctx);
        }
        return stages.get(index).process(ctx, guarded(index + 1, terminal));
      } catch (RuntimeException e) {
        logger.log(Level.FINE, "Pipeline stage " + index + " threw for " + ctx, e);
        return classifier.toFailure(e);
      }
    };
  }
}
