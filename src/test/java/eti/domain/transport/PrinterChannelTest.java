package eti.domain.transport;

import eti.domain.ErrorCode;
import eti.domain.Result;
import eti.domain.policy.TimeoutPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for PrinterChannel
 */
@ExtendWith(MockitoExtension.class)
class PrinterChannelTest {

    @Mock
    private IPrinterTransport transport;

    private TimeoutPolicy timeoutPolicy;
    private PrinterChannel channel;

    @BeforeEach
    void setUp() {
        timeoutPolicy = new TimeoutPolicy();
        channel = new PrinterChannel(transport, timeoutPolicy, 1000);
    }

    @AfterEach
    void tearDown() {
        timeoutPolicy.shutdown();
    }

    @Test
    @DisplayName("Should parse the value of a setting response")
    void shouldParseSettingValue() {
        // Given
        when(transport.query("device.languages")).thenReturn(Result.success("\"line_print\""));

        // When
        Result<String> result = channel.getSetting("device.languages");

        // Then
        assertThat(result.getData()).isEqualTo("line_print");
    }

    @Test
    @DisplayName("Should return successful null for an empty response")
    void shouldReturnNullForEmptyResponse() {
        when(transport.query("media.status")).thenReturn(Result.success("\"\""));

        Result<String> result = channel.getSetting("media.status");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).isNull();
    }

    @Test
    @DisplayName("Should forward transport failures unchanged")
    void shouldForwardTransportFailures() {
        Result<String> failure = Result.failure(ErrorCode.CONNECTION_LOST);
        when(transport.query("media.status")).thenReturn(failure);

        Result<String> result = channel.getSetting("media.status");

        assertThat(result.getError()).isSameAs(failure.getError());
    }

    @Test
    @DisplayName("Should encode setvar on the wire")
    void shouldEncodeSetvar() {
        // Given
        when(transport.sendRaw(any())).thenReturn(Result.success());
        ArgumentCaptor<byte[]> captor = ArgumentCaptor.forClass(byte[].class);

        // When
        channel.setSetting("device.pause", "false");

        // Then
        verify(transport).sendRaw(captor.capture());
        assertThat(new String(captor.getValue(), StandardCharsets.UTF_8))
                .isEqualTo("! U1 setvar \"device.pause\" \"false\"\r\n");
    }

    @Test
    @DisplayName("Should bound a hung transport call by the command timeout")
    void shouldBoundHungCall() {
        // Given
        PrinterChannel fastChannel = new PrinterChannel(transport, timeoutPolicy, 50);
        when(transport.query("device.host_status")).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return Result.success("\"0\"");
        });

        // When
        Result<String> result = fastChannel.getSetting("device.host_status");

        // Then
        assertThat(result.getError().is(ErrorCode.OPERATION_TIMEOUT)).isTrue();
    }
}
