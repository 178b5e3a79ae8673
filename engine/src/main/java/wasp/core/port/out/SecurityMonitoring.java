package wasp.core.port.out;

import wasp.spi.SecurityEvent;

/**
 * Where the admission, aggregation and queue paths report notable defense activity.
 * Publishing is fire-and-forget: an unavailable monitor must never slow a verdict.
 */
public interface SecurityMonitoring {

    boolean isEnabled();

    void dispatch(SecurityEvent event);
}
