package kr.jemi.zaccess.payment.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayTransactionStatusTest {

    @Test
    @DisplayName("대소문자를 구분하지 않고 파싱한다")
    void parsesCaseInsensitive() {
        assertThat(GatewayTransactionStatus.from("settlement")).isEqualTo(GatewayTransactionStatus.SETTLEMENT);
        assertThat(GatewayTransactionStatus.from(" Capture ")).isEqualTo(GatewayTransactionStatus.CAPTURE);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  ", "refund", "chargeback"})
    @DisplayName("알 수 없는 값은 UNKNOWN")
    void unknownValues(String value) {
        assertThat(GatewayTransactionStatus.from(value)).isEqualTo(GatewayTransactionStatus.UNKNOWN);
    }

    @Test
    @DisplayName("UNKNOWN은 성공도 실패도 대기도 아니다")
    void unknownIsNeutral() {
        GatewayTransactionStatus unknown = GatewayTransactionStatus.UNKNOWN;

        assertThat(unknown.isSuccess()).isFalse();
        assertThat(unknown.isFailure()).isFalse();
        assertThat(unknown.isPending()).isFalse();
    }

    @Test
    @DisplayName("분류")
    void classification() {
        assertThat(GatewayTransactionStatus.DENY.isFailure()).isTrue();
        assertThat(GatewayTransactionStatus.EXPIRE.isFailure()).isTrue();
        assertThat(GatewayTransactionStatus.AUTHORIZE.isPending()).isTrue();
        assertThat(GatewayTransactionStatus.SETTLEMENT.isSuccess()).isTrue();
    }
}
