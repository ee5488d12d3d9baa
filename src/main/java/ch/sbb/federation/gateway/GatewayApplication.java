package ch.sbb.federation.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the GraphQL federation gateway.
 *
 * <p>The gateway composes the schemas of independently deployed subgraphs into one
 * federated schema, plans client queries across the owning subgraphs and stitches
 * entity references into a single response. Subgraph health is monitored in the
 * background so that unavailable subgraphs degrade into field errors.</p>
 */
@SpringBootApplication
@EnableScheduling
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }
}
