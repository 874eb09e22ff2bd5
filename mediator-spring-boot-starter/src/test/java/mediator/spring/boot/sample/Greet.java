package mediator.spring.boot.sample;

import mediator.Request;

public record Greet(String name) implements Request<String> {
}
