/**
 * Request dispatch: {@link mediator.dispatch.DefaultMediator} and its resolution cache.
 *
 * <p>A dispatch is a single resolve-then-invoke sequence. The only shared mutable state is the
 * {@link mediator.dispatch.HandlerInvokerCache}, populated insert-if-absent.
 */
package mediator.dispatch;
