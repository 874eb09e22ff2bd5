/**
 * Default in-memory service container with constructor injection.
 *
 * @see mediator.container.DefaultServiceContainer
 */
package mediator.container;
