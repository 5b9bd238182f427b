package eti.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for Result and ErrorCode formatting
 */
class ResultTest {

    @Test
    @DisplayName("Should carry data and no error on success")
    void shouldCarryDataOnSuccess() {
        // When
        Result<String> result = Result.success("zpl");

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getData()).isEqualTo("zpl");
        assertThat(result.getError()).isNull();
    }

    @Test
    @DisplayName("Should carry error and no data on failure")
    void shouldCarryErrorOnFailure() {
        // When
        Result<String> result = Result.failure(ErrorCode.PRINT_DATA_TOO_LARGE, 1_500_000);

        // Then
        assertThat(result.isFailure()).isTrue();
        assertThat(result.getData()).isNull();
        assertThat(result.getError().getCode()).isEqualTo("PRINT_DATA_TOO_LARGE");
        assertThat(result.getError().getMessage()).isEqualTo("Print data too large: 1500000 bytes");
        assertThat(result.getError().getCategory()).isEqualTo(EErrorCategory.DATA);
        assertThat(result.getError().getRecoveryHint()).isNotBlank();
    }

    @Test
    @DisplayName("Should forward the same error when propagating")
    void shouldForwardSameErrorWhenPropagating() {
        // Given
        Result<String> original = Result.failure(ErrorCode.STATUS_TIMEOUT);

        // When
        Result<Integer> forwarded = original.propagate();

        // Then
        assertThat(forwarded.getError()).isSameAs(original.getError());
    }

    @Test
    @DisplayName("Should refuse to propagate a success")
    void shouldRefuseToPropagateSuccess() {
        assertThatThrownBy(() -> Result.success("x").propagate())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should map only successful results")
    void shouldMapOnlySuccessfulResults() {
        assertThat(Result.success("abc").map(String::length).getData()).isEqualTo(3);
        assertThat(Result.<String>failure(ErrorCode.EMPTY_DATA).map(String::length).isFailure()).isTrue();
    }

    @Test
    @DisplayName("Should format two-argument templates")
    void shouldFormatTwoArgumentTemplates() {
        assertThat(ErrorCode.LANGUAGE_MISMATCH.format("ZPL", "line_print"))
                .isEqualTo("Printer language mismatch: expected ZPL, got line_print");
    }
}
