package mediator.util;

import org.junit.jupiter.api.Test;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GenericTypesTest {

    @Test
    void resolvesDirectInterfaceArguments() {
        Type[] arguments = GenericTypes.resolveTypeArguments(Length.class, Function.class);

        assertArrayEquals(new Type[] {String.class, Integer.class}, arguments);
    }

    @Test
    void resolvesThroughGenericSuperclass() {
        Type[] arguments = GenericTypes.resolveTypeArguments(WordCount.class, Function.class);

        assertArrayEquals(new Type[] {String.class, Integer.class}, arguments);
    }

    @Test
    void keepsParameterizedArguments() {
        Type[] arguments = GenericTypes.resolveTypeArguments(Splitter.class, Function.class);

        assertEquals(String.class, arguments[0]);
        ParameterizedType list = assertInstanceOf(ParameterizedType.class, arguments[1]);
        assertEquals(List.class, GenericTypes.rawClass(list));
        assertTrue(GenericTypes.isFullyResolved(list));
    }

    @Test
    void unboundVariableIsNotResolved() {
        Type[] arguments = GenericTypes.resolveTypeArguments(Identity.class, Function.class);

        assertFalse(GenericTypes.isFullyResolved(arguments[0]));
        assertNull(GenericTypes.rawClass(arguments[0]));
    }

    @Test
    void unrelatedOrRawTypesResolveToNull() {
        assertNull(GenericTypes.resolveTypeArguments(String.class, Function.class));
        assertNull(GenericTypes.resolveTypeArguments(Function.class, Function.class));
        assertNull(GenericTypes.resolveTypeArguments(RawFunction.class, Function.class));
    }

    @Test
    void rejectsNonGenericSupertype() {
        assertThrows(IllegalArgumentException.class,
                () -> GenericTypes.resolveTypeArguments(ArrayList.class, Runnable.class));
    }

    static class Length implements Function<String, Integer> {
        @Override
        public Integer apply(String value) {
            return value.length();
        }
    }

    abstract static class ToInteger<T> implements Function<T, Integer> {
    }

    static class WordCount extends ToInteger<String> {
        @Override
        public Integer apply(String value) {
            return value.split(" ").length;
        }
    }

    static class Splitter implements Function<String, List<String>> {
        @Override
        public List<String> apply(String value) {
            return List.of(value.split(","));
        }
    }

    static class Identity<T> implements Function<T, T> {
        @Override
        public T apply(T value) {
            return value;
        }
    }

    @SuppressWarnings("rawtypes")
    static class RawFunction implements Function {
        @Override
        public Object apply(Object value) {
            return value;
        }
    }
}
