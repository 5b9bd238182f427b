package eti.domain.transport;

import eti.common.SgdConstants;
import eti.domain.ErrorCode;
import eti.domain.Result;
import eti.domain.protocol.SgdCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for DummyPrinterTransport
 */
class DummyPrinterTransportTest {

    private DummyPrinterTransport transport;

    @BeforeEach
    void setUp() {
        transport = new DummyPrinterTransport();
    }

    @Test
    @DisplayName("Should refuse queries before connecting")
    void shouldRefuseQueriesBeforeConnecting() {
        // When
        Result<String> result = transport.query(SgdConstants.KEY_LANGUAGES);

        // Then
        assertThat(result.getError().is(ErrorCode.NOT_CONNECTED)).isTrue();
        assertThat(transport.getQueryCount()).isZero();
    }

    @Test
    @DisplayName("Should answer a healthy printer by default")
    void shouldAnswerHealthyPrinterByDefault() {
        // Given
        transport.connect("10.0.0.5:9100");

        // Then
        assertThat(transport.isConnected().getData()).isTrue();
        assertThat(transport.getConnectedAddress()).isEqualTo("10.0.0.5:9100");
        assertThat(transport.query(SgdConstants.KEY_LANGUAGES).getData()).isEqualTo("\"zpl\"");
        assertThat(transport.query(SgdConstants.KEY_MEDIA_STATUS).getData()).isEqualTo("\"ok\"");
        assertThat(transport.query("unknown.key").getData()).isEqualTo("\"?\"");
        assertThat(transport.getQueryCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should apply setvar commands it receives")
    void shouldApplySetvarCommands() {
        // Given
        transport.connect("printer");

        // When
        transport.sendRaw(SgdCodec.toBytes(SgdCodec.set(SgdConstants.KEY_LANGUAGES, "line_print")));

        // Then
        assertThat(transport.getSetting(SgdConstants.KEY_LANGUAGES)).isEqualTo("line_print");
        assertThat(transport.getReceivedText()).hasSize(1);
    }

    @Test
    @DisplayName("Should record raw payloads unchanged")
    void shouldRecordRawPayloads() {
        // Given
        transport.connect("printer");

        // When
        transport.sendRaw(new byte[]{SgdConstants.CLEAR_BUFFER});

        // Then
        assertThat(transport.getReceived()).hasSize(1);
        assertThat(transport.getReceived().get(0)).containsExactly(SgdConstants.CLEAR_BUFFER);
    }

    @Test
    @DisplayName("Should report disconnected after disconnect")
    void shouldReportDisconnected() {
        // Given
        transport.connect("printer");

        // When
        transport.disconnect();

        // Then
        assertThat(transport.isConnected().getData()).isFalse();
        assertThat(transport.sendRaw(new byte[]{1}).isFailure()).isTrue();
    }
}
