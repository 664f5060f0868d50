package kr.jemi.zaccess.payment.infrastructure.in.web.dto;

import java.util.Map;

public record PaymentJobResponse(String job, Map<String, Integer> counts) {
}
