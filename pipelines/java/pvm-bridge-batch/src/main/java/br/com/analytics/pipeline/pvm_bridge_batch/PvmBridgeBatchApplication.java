package br.com.analytics.pipeline.pvm_bridge_batch;

import br.com.analytics.pipeline.pvm_bridge_batch.config.BridgeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(BridgeProperties.class)
public class PvmBridgeBatchApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PvmBridgeBatchApplication.class, args)));
    }
}
