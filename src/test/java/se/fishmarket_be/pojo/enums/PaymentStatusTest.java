package se.fishmarket_be.pojo.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentStatusTest {

    @ParameterizedTest
    @CsvSource({
            "settlement, PAID",
            "capture, PAID",
            "SETTLEMENT, PAID",
            "deny, FAILED",
            "expire, FAILED",
            "failure, FAILED",
            "cancel, CANCELLED",
            "pending, PENDING",
            "authorize, PENDING"
    })
    @DisplayName("gateway statuses map onto payment statuses")
    void fromGatewayStatus(String gatewayStatus, PaymentStatus expected) {
        assertThat(PaymentStatus.fromGatewayStatus(gatewayStatus)).isEqualTo(expected);
    }

    @Test
    @DisplayName("missing gateway status stays pending")
    void fromGatewayStatus_Null() {
        assertThat(PaymentStatus.fromGatewayStatus(null)).isEqualTo(PaymentStatus.PENDING);
    }

    @Test
    @DisplayName("only pending is non-terminal")
    void isTerminal() {
        assertThat(PaymentStatus.PENDING.isTerminal()).isFalse();
        assertThat(PaymentStatus.PAID.isTerminal()).isTrue();
        assertThat(PaymentStatus.FAILED.isTerminal()).isTrue();
        assertThat(PaymentStatus.CANCELLED.isTerminal()).isTrue();
    }
}
