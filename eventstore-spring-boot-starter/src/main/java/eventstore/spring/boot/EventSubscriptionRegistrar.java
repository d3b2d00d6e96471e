package eventstore.spring.boot;

import eventstore.EventStore;
import eventstore.subscription.Subscriber;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.Map;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link EventSubscription} and subscribes them to the
 * {@link EventStore}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see EventSubscription
 */
public class EventSubscriptionRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(EventSubscriptionRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final EventStore eventStore;

    public EventSubscriptionRegistrar(ListableBeanFactory beanFactory, EventStore eventStore) {
        this.beanFactory = beanFactory;
        this.eventStore = eventStore;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(EventSubscription.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof Subscriber subscriber)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @EventSubscription must implement Subscriber, " +
                                "but " + bean.getClass().getName() + " does not");
            }
            // Proxies may hide the annotation
            EventSubscription annotation = AnnotationUtils.findAnnotation(bean.getClass(), EventSubscription.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @EventSubscription annotation on " + bean.getClass().getName());
            }
            if (annotation.name().isEmpty()) {
                throw new BeanCreationException(beanName, "@EventSubscription name must not be empty");
            }

            if (annotation.stream().isEmpty()) {
                eventStore.subscribeToAllStreams(annotation.name(), subscriber);
            } else {
                eventStore.subscribeToStream(annotation.stream(), annotation.name(), subscriber);
            }
            logger.fine(() -> "Subscribed bean '" + beanName + "' as " + annotation.name());
        }
    }
}
