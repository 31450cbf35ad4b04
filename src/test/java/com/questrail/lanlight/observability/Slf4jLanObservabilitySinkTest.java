package com.questrail.lanlight.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.questrail.lanlight.api.CommandKind;
import com.questrail.lanlight.api.CommandOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jLanObservabilitySinkTest
{
    private final Logger logger = (Logger) LoggerFactory.getLogger(Slf4jLanObservabilitySink.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private final Slf4jLanObservabilitySink sink = new Slf4jLanObservabilitySink();

    @BeforeEach
    void attach()
    {
        logger.setLevel(Level.DEBUG);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach()
    {
        logger.detachAppender(appender);
        appender.stop();
        logger.setLevel(null);
    }

    @Test
    void exhaustedCommandLogsAtInfo()
    {
        sink.onCommandFinished(new CommandFinishedEvent("AA:BB", CommandKind.BRIGHTNESS, CommandOutcome.EXHAUSTED, 11));

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.INFO, event.getLevel());
        assertEquals("Command BRIGHTNESS for AA:BB not confirmed after 11 sends", event.getFormattedMessage());
    }

    @Test
    void verifiedCommandLogsAtDebug()
    {
        sink.onCommandFinished(new CommandFinishedEvent("AA:BB", CommandKind.POWER, CommandOutcome.VERIFIED, 1));

        assertEquals(1, appender.list.size());
        assertEquals(Level.DEBUG, appender.list.get(0).getLevel());
    }

    @Test
    void transportDownWithCauseWarnsAndCarriesThrowable()
    {
        sink.onTransportEvent(new TransportEvent("0.0.0.0:4002", true, null));
        sink.onTransportEvent(new TransportEvent("0.0.0.0:4002", false, new IOException("gone")));

        assertEquals(Level.INFO, appender.list.get(0).getLevel());
        ILoggingEvent down = appender.list.get(1);
        assertEquals(Level.WARN, down.getLevel());
        assertNotNull(down.getThrowableProxy());
        assertEquals("gone", down.getThrowableProxy().getMessage());
    }

    @Test
    void errorsLogAtError()
    {
        sink.onError(new LanErrorEvent("poll failed", new IllegalStateException("boom")));

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.ERROR, event.getLevel());
        assertEquals("LAN control error: poll failed", event.getFormattedMessage());
    }
}
