/**
 * Handler discovery: turns candidate classes into container registrations keyed by
 * {@code RequestHandler<Q, R>}.
 *
 * @see mediator.registry.HandlerRegistrar
 */
package mediator.registry;
