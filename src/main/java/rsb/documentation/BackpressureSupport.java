package rsb.documentation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Documents how a publisher or subscriber deals with backpressure on its input and output side.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface BackpressureSupport {

    /**
     * @return the mode towards the producer this component consumes
     */
    BackpressureMode input();

    /**
     * @return the mode towards the subscriber of this component
     */
    BackpressureMode output();
}
