package mediator.spring.boot.duplicate;

import mediator.CancellationToken;
import mediator.RequestHandler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

public class SecondPingHandler implements RequestHandler<Ping, String> {

    @Override
    public CompletionStage<String> handle(Ping request, CancellationToken cancellationToken) {
        return CompletableFuture.completedFuture("second");
    }
}
