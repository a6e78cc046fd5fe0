package tech.tessera.identity.event;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Default sink: records each event in the log. Replaced by a delivering
 * implementation where webhooks or mail are wired.
 */
@ApplicationScoped
@DefaultBean
public class LoggingEventEmitter implements EventEmitter {

    private static final Logger LOG = Logger.getLogger(LoggingEventEmitter.class);

    @Override
    public void emit(IdentityEvent event) {
        LOG.infof("Event %s [%s] membership=%s utilizer=%s subject=%s",
            event.eventType(), event.eventId(), event.membershipId(), event.principalId(), event.subjectId());
    }
}
