package io.datawrangle.core.connector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.datawrangle.core.error.ConnectionError;
import io.datawrangle.core.error.ConnectorIOError;
import io.datawrangle.core.model.Section;
import io.datawrangle.core.model.StepPosition;
import io.datawrangle.core.spi.Connector;
import io.datawrangle.core.spi.ConnectorHandle;
import io.datawrangle.core.spi.Credentials;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

/** Handle ownership and error attribution around a single connector. */
@ExtendWith(MockitoExtension.class)
class ConnectorSessionTest {

    private static final StepPosition POSITION = StepPosition.of(Section.READ, 1);
    private static final ObjectNode SETTINGS = JsonNodeFactory.instance.objectNode();

    @Mock
    private Connector connector;

    private final ConnectorHandle handle = () -> "mock://orders";

    @BeforeEach
    void setUp() {
        when(connector.id()).thenReturn("mock");
    }

    private ConnectorSession open() {
        when(connector.open(any(), any())).thenReturn(handle);
        return ConnectorSession.open(connector, SETTINGS, Credentials.none(), POSITION, "mock");
    }

    @Test
    @DisplayName("close() releases the handle once")
    void closesOnce() {
        ConnectorSession session = open();

        session.close();
        session.close();

        verify(connector, times(1)).close(handle);
    }

    @Test
    void closeFailureIsLoggedNotThrown() {
        Logger logger = (Logger) LoggerFactory.getLogger(ConnectorSession.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            ConnectorSession session = open();
            doThrow(new IllegalStateException("socket gone")).when(connector).close(handle);

            session.close();

            assertThat(appender.list)
                    .filteredOn(e -> e.getLevel() == Level.WARN)
                    .singleElement()
                    .satisfies(e -> assertThat(e.getFormattedMessage())
                            .isEqualTo("Connector close failed: connector=mock, location=mock://orders"));
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    @DisplayName("Unexpected read failure → ConnectorIOError attributed to the step")
    void readFailureAttributed() {
        ConnectorSession session = open();
        when(connector.read(handle)).thenThrow(new IllegalStateException("boom"));

        var ex = catchThrowableOfType(session::read, ConnectorIOError.class);

        assertThat(ex).hasMessage("mock read failed at mock://orders: boom");
        assertThat(ex.position()).isEqualTo(POSITION);
        assertThat(ex.kind()).isEqualTo("mock");
        assertThat(ex.location()).isEqualTo("mock://orders");
    }

    @Test
    void connectorErrorKeepsItsMessage() {
        ConnectorSession session = open();
        when(connector.read(handle)).thenThrow(new ConnectorIOError("disk full", null, "mock://orders"));

        var ex = catchThrowableOfType(session::read, ConnectorIOError.class);

        assertThat(ex).hasMessage("disk full");
        assertThat(ex.position()).isEqualTo(POSITION);
    }

    @Test
    @DisplayName("Open failure → ConnectionError, nothing to close")
    void openFailure() {
        when(connector.open(any(), any())).thenThrow(new IllegalArgumentException("bad settings"));

        var ex = catchThrowableOfType(
                () -> ConnectorSession.open(connector, SETTINGS, Credentials.none(), POSITION, "mock"),
                ConnectionError.class);

        assertThat(ex).hasMessage("Failed to open mock connector: bad settings");
        assertThat(ex.position()).isEqualTo(POSITION);
    }

    @Test
    @DisplayName("invoke on a connector without invoke → IllegalStateException")
    void invokeNeedsInvocableConnector() {
        ConnectorSession session = open();

        assertThatThrownBy(() -> session.invoke(SETTINGS))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("does not support invoke");
    }
}
