package mediator.spring.boot.sample;

public interface GreetingFormatter {
    String format(String name);
}
