/**
 * Spring container adapter: lets the mediator resolve handlers from, and register them into, a
 * Spring bean factory.
 *
 * @see mediator.spring.BeanFactoryServiceProvider
 * @see mediator.spring.BeanDefinitionServiceRegistry
 */
package mediator.spring;
