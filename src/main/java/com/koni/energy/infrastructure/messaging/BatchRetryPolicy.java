package com.koni.energy.infrastructure.messaging;

import com.koni.energy.domain.exception.MalformedBatchException;
import com.koni.energy.infrastructure.config.EnergyPipelineProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.kafka.support.serializer.DeserializationException;
import org.springframework.stereotype.Component;

/**
 * Decides which batch failures are worth re-delivering and how many processing attempts a
 * batch gets before it is dead-lettered.
 */
@Component
@RequiredArgsConstructor
public class BatchRetryPolicy {

    private final EnergyPipelineProperties properties;

    /**
     * Failures caused by the content itself cannot be fixed by re-delivering the same bytes.
     *
     * @param failure the failure, already unwrapped from listener wrappers
     * @return true if the batch should be re-delivered
     */
    public boolean isRetryable(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof MalformedBatchException || t instanceof DeserializationException) {
                return false;
            }
        }
        return true;
    }

    public int maxRetries() {
        return properties.getPipeline().getRetry().getMaxRetries();
    }

    /**
     * Used when the container did not report the delivery attempt.
     *
     * @return processing attempts made before a batch failing with this error is dead-lettered
     */
    public int attemptsFor(Throwable failure) {
        return isRetryable(failure) ? maxRetries() + 1 : 1;
    }
}
