package com.example.blockalert.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.util.backoff.BackOff;

/**
 * Logs one line per failed alert change record instead of a stack trace per retry.
 */
@Slf4j
public class ConciseLoggingErrorHandler extends DefaultErrorHandler {

    public ConciseLoggingErrorHandler(DeadLetterPublishingRecoverer recoverer, BackOff backOff) {
        super(recoverer, backOff);
    }

    @Override
    public boolean handleOne(Exception thrownException, ConsumerRecord<?, ?> record, Consumer<?, ?> consumer,
                             MessageListenerContainer container) {
        log.error("Alert change record failed. topic={}, partition={}, offset={}, key={}, error='{}'",
                record.topic(), record.partition(), record.offset(), record.key(), thrownException.getMessage());
        if (log.isDebugEnabled()) {
            log.debug("Stack trace for failed alert change record", thrownException);
        }
        return super.handleOne(thrownException, record, consumer, container);
    }
}
