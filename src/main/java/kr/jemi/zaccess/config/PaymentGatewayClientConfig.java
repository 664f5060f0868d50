package kr.jemi.zaccess.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

@Configuration
public class PaymentGatewayClientConfig {

    /**
     * 결제 게이트웨이 상태 조회용 클라이언트. 서버 키를 사용자명으로 하는 Basic 인증을 쓴다.
     * 호출이 멈춰도 타임아웃이 유일한 중단 수단이므로 반드시 설정한다.
     */
    @Bean
    public RestClient paymentGatewayRestClient(
            RestClient.Builder builder,
            @Value("${zaccess.payment.gateway.base-url}") String baseUrl,
            @Value("${zaccess.payment.gateway.server-key}") String serverKey,
            @Value("${zaccess.payment.gateway.connect-timeout}") Duration connectTimeout,
            @Value("${zaccess.payment.gateway.read-timeout}") Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);

        String credentials = Base64.getEncoder()
                .encodeToString((serverKey + ":").getBytes(StandardCharsets.UTF_8));

        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Basic " + credentials)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
