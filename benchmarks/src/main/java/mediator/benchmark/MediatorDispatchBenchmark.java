package mediator.benchmark;

import mediator.CancellationToken;
import mediator.CancellationTokenSource;
import mediator.Mediator;
import mediator.Mediators;
import mediator.Request;
import mediator.RequestHandler;
import mediator.container.DefaultServiceContainer;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;

/**
 * Measures repeated dispatch through the default container: handler resolution, cached invoker
 * lookup and invocation of a handler that completes synchronously.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar MediatorDispatchBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class MediatorDispatchBenchmark {

  private Mediator mediator;
  private CancellationToken liveToken;

  @Setup(Level.Trial)
  public void setup() {
    DefaultServiceContainer container = Mediators.addMediator(new DefaultServiceContainer(),
        AddHandler.class);
    mediator = container.resolve(Mediator.class);
    liveToken = new CancellationTokenSource().token();
  }

  @Benchmark
  public Integer send() {
    return mediator.send(new Add(20, 22)).join();
  }

  @Benchmark
  public Integer sendWithCancellableToken() {
    return mediator.send(new Add(20, 22), liveToken).join();
  }

  @Benchmark
  @Threads(4)
  public Integer sendContended() {
    return mediator.send(new Add(20, 22)).join();
  }

  public record Add(int left, int right) implements Request<Integer> {
  }

  public static class AddHandler implements RequestHandler<Add, Integer> {
    @Override
    public CompletionStage<Integer> handle(Add request, CancellationToken cancellationToken) {
      return CompletableFuture.completedFuture(request.left() + request.right());
    }
  }
}
