package mediator.util;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves the type arguments a class binds for a generic supertype.
 *
 * <p>Walks generic superclasses and super-interfaces, substituting type variables bound along
 * the way, so {@code class UserHandler extends BaseHandler<GetUser>} where
 * {@code BaseHandler<Q> implements RequestHandler<Q, UserDto>} resolves to
 * {@code [GetUser, UserDto]}.
 */
public final class GenericTypes {

  private GenericTypes() {
  }

  /**
   * Returns the type arguments {@code type} binds for {@code genericSupertype}.
   *
   * <p>Arguments that stay generic are returned as {@link TypeVariable}s; use
   * {@link #isFullyResolved(Type)} to check them.
   *
   * @param type the class to inspect
   * @param genericSupertype a generic class or interface
   * @return the arguments in declaration order, or {@code null} if {@code type} does not extend
   *     {@code genericSupertype} or only extends its raw form
   */
  public static Type[] resolveTypeArguments(Class<?> type, Class<?> genericSupertype) {
    if (genericSupertype.getTypeParameters().length == 0) {
      throw new IllegalArgumentException(genericSupertype.getName() + " is not generic");
    }
    if (!genericSupertype.isAssignableFrom(type) || type == genericSupertype) {
      return null;
    }
    return resolve(type, genericSupertype, Map.of());
  }

  /**
   * Returns whether a type contains no type variables or wildcards.
   *
   * @param type the type
   * @return {@code true} for classes and parameterized or array types built only from them
   */
  public static boolean isFullyResolved(Type type) {
    if (type instanceof Class<?>) {
      return true;
    }
    if (type instanceof ParameterizedType parameterized) {
      for (Type argument : parameterized.getActualTypeArguments()) {
        if (!isFullyResolved(argument)) {
          return false;
        }
      }
      return true;
    }
    if (type instanceof GenericArrayType array) {
      return isFullyResolved(array.getGenericComponentType());
    }
    return false;
  }

  /**
   * Returns the erasure of a class or parameterized type.
   *
   * @param type the type
   * @return the raw class, or {@code null} for type variables, wildcards and generic arrays
   */
  public static Class<?> rawClass(Type type) {
    if (type instanceof Class<?> cls) {
      return cls;
    }
    if (type instanceof ParameterizedType parameterized
        && parameterized.getRawType() instanceof Class<?> raw) {
      return raw;
    }
    return null;
  }

  private static Type[] resolve(Type type, Class<?> target, Map<TypeVariable<?>, Type> bindings) {
    Class<?> raw = rawClass(type);
    if (raw == null) {
      return null;
    }
    Map<TypeVariable<?>, Type> local = Map.of();
    if (type instanceof ParameterizedType parameterized) {
      TypeVariable<?>[] variables = raw.getTypeParameters();
      Type[] arguments = parameterized.getActualTypeArguments();
      local = new HashMap<>();
      for (int i = 0; i < variables.length; i++) {
        local.put(variables[i], substitute(arguments[i], bindings));
      }
    }
    if (raw == target) {
      if (!(type instanceof ParameterizedType)) {
        return null;
      }
      TypeVariable<?>[] variables = raw.getTypeParameters();
      Type[] resolved = new Type[variables.length];
      for (int i = 0; i < variables.length; i++) {
        resolved[i] = local.get(variables[i]);
      }
      return resolved;
    }
    for (Type superInterface : raw.getGenericInterfaces()) {
      if (target.isAssignableFrom(rawClass(superInterface))) {
        return resolve(superInterface, target, local);
      }
    }
    Type superclass = raw.getGenericSuperclass();
    if (superclass != null && target.isAssignableFrom(rawClass(superclass))) {
      return resolve(superclass, target, local);
    }
    return null;
  }

  private static Type substitute(Type type, Map<TypeVariable<?>, Type> bindings) {
    if (type instanceof TypeVariable<?> variable && bindings.containsKey(variable)) {
      return bindings.get(variable);
    }
    return type;
  }
}
