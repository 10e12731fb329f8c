package eventsource.bus;

import eventsource.DomainEvent;
import eventsource.handler.AsyncEventHandler;
import eventsource.handler.ErrorClassifier;
import eventsource.handler.ErrorKind;
import eventsource.handler.EventHandler;
import eventsource.handler.HandlerResult;

import java.time.Duration;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handler call resolved once per subscription, so dispatch never re-inspects the
 * handler's shape.
 */
sealed interface SubscriptionInvoker permits SubscriptionInvoker.Sync, SubscriptionInvoker.Async {

  boolean canHandle(DomainEvent event);

  HandlerResult invoke(DomainEvent event, Duration asyncTimeout, ErrorClassifier classifier);

  record Sync(EventHandler<DomainEvent> handler) implements SubscriptionInvoker {
    @Override
    public boolean canHandle(DomainEvent event) {
      return handler.canHandle(event);
    }

    @Override
    public HandlerResult invoke(DomainEvent event, Duration asyncTimeout, ErrorClassifier classifier) {
      try {
        handler.handle(event);
        return HandlerResult.success();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return HandlerResult.failure(ErrorKind.CANCELLED, "Handler interrupted", e);
      } catch (Exception e) {
        return classifier.toFailure(e);
      }
    }
  }

  record Async(AsyncEventHandler<DomainEvent> handler) implements SubscriptionInvoker {
    @Override
    public boolean canHandle(DomainEvent event) {
      return handler.canHandle(event);
    }

    @Override
    public HandlerResult invoke(DomainEvent event, Duration asyncTimeout, ErrorClassifier classifier) {
      try {
        CompletionStage<?> stage = handler.handle(event);
        if (stage == null) {
          return HandlerResult.success();
        }
        Object value = stage.toCompletableFuture().get(asyncTimeout.toMillis(), TimeUnit.MILLISECONDS);
        return HandlerResult.success(value);
      } catch (TimeoutException e) {
        return HandlerResult.failure(ErrorKind.TIMEOUT,
            "Async handler did not complete within " + asyncTimeout.toMillis() + " ms", e);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return HandlerResult.failure(ErrorKind.CANCELLED, "Interrupted awaiting async handler", e);
      } catch (ExecutionException e) {
        return classifier.toFailure(e.getCause() != null ? e.getCause() : e);
      } catch (Exception e) {
        return classifier.toFailure(e);
      }
    }
  }
}
