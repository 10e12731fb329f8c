package eventsource.middleware;

import eventsource.handler.HandlerResult;

/**
 * One stage of a {@link MiddlewarePipeline}.
 *
 * <p>A stage may call {@code next} once (observe), several times (retry), or not at all
 * (short-circuit). Stages nest in registration order: the first registered stage is the
 * outermost and sees the final result of everything inside it.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventMiddleware audit = EventMiddleware.observing((ctx, result) ->
 *     auditLog.record(ctx.event().eventId(), result.isSuccess()));
 * }</pre>
 */
@FunctionalInterface
public interface EventMiddleware {

    /**
     * Processes one handler invocation.
     *
     * @param context the invocation being processed
     * @param next    continuation running the remaining stages and the handler
     * @return the invocation's result; failures are returned, not thrown
     */
    HandlerResult process(HandlerContext context, Next next);

    /**
     * Continuation to the rest of the pipeline.
     */
    @FunctionalInterface
    interface Next {
        HandlerResult proceed(HandlerContext context);
    }

    /**
     * Creates a stage that calls {@code next} exactly once and reports its result.
     */
    static EventMiddleware observing(Observer observer) {
        return (context, next) -> {
            HandlerResult result = next.proceed(context);
            observer.observe(context, result);
            return result;
        };
    }

    @FunctionalInterface
    interface Observer {
        void observe(HandlerContext context, HandlerResult result);
    }
}
