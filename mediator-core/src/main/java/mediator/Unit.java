package mediator;

import java.io.Serial;
import java.io.Serializable;

/**
 * Response type for requests that perform an action and return no data.
 *
 * <p>Every {@code Unit} is equal to every other, hashes to {@code 0} and prints as {@code ()}.
 *
 * <pre>{@code
 * public record DeleteUser(String id) implements Request<Unit> {}
 *
 * return CompletableFuture.completedFuture(Unit.VALUE);
 * }</pre>
 */
public final class Unit implements Comparable<Unit>, Serializable {

  @Serial
  private static final long serialVersionUID = 1L;

  /** The shared instance. */
  public static final Unit VALUE = new Unit();

  private Unit() {
  }

  @Override
  public int compareTo(Unit other) {
    return 0;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Unit;
  }

  @Override
  public int hashCode() {
    return 0;
  }

  @Override
  public String toString() {
    return "()";
  }

  @Serial
  private Object readResolve() {
    return VALUE;
  }
}
