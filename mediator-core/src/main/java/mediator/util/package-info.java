/**
 * Reflection helpers for resolving the type arguments handlers and requests bind.
 */
package mediator.util;
