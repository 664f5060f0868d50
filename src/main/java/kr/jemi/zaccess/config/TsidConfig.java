package kr.jemi.zaccess.config;

import io.hypersistence.tsid.TSID;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TsidConfig {

    @Bean
    public TSID.Factory tsidFactory(@Value("${zaccess.tsid.node-bits}") int nodeBits,
                                    @Value("${zaccess.tsid.node}") int node) {
        int maxNodeCount = 1 << nodeBits;
        if (node < 0 || node >= maxNodeCount) {
            throw new IllegalStateException(
                    "TSID 노드 번호는 0 이상 " + maxNodeCount + " 미만이어야 합니다: " + node);
        }
        return TSID.Factory.builder()
                .withNodeBits(nodeBits)
                .withNode(node)
                .build();
    }
}
