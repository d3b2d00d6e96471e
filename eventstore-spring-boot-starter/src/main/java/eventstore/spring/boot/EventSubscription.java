package eventstore.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a persistent subscription that is started with the context.
 *
 * <p>The annotated bean must implement {@link eventstore.subscription.Subscriber}.
 *
 * <pre>{@code
 * @Component
 * @EventSubscription(name = "order-projector", stream = "order-42")
 * public class OrderProjector implements Subscriber {
 *   public void onEvent(SubscriptionHandle subscription, RecordedEvent event) {
 *     ...
 *     subscription.ack(event);
 *   }
 * }
 * }</pre>
 *
 * @see EventSubscriptionRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventSubscription {

    /**
     * Durable subscription name, unique within its scope.
     */
    String name();

    /**
     * Stream to follow. Empty (the default) subscribes to all streams.
     */
    String stream() default "";
}
