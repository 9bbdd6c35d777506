/**
 * Main application class for Proxy Machine
 *
 * Features:
 * - Runs without a web server; the card index and fetch pipeline are used in-process
 * - Verifies the card index on startup and logs how to fix a missing or stale one
 */

package net.proxymachine;

import net.proxymachine.model.IndexStatus;
import net.proxymachine.service.CardIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProxyMachineApplication implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ProxyMachineApplication.class);

    private final CardIndexService cardIndexService;

    public ProxyMachineApplication(CardIndexService cardIndexService) {
        this.cardIndexService = cardIndexService;
    }

    public static void main(String[] args) {
        SpringApplication.run(ProxyMachineApplication.class, args);
    }

    @Override
    public void run(ApplicationArguments args) {
        IndexStatus status = cardIndexService.status();
        if (status.available()) {
            log.info("Card index ready: prints={} edges={} schema={} fts={} builtAt={}",
                status.printCount(), status.edgeCount(), status.schemaVersion(), status.ftsEnabled(), status.builtAt());
        } else {
            log.warn("Card index unavailable: {}", status.unavailableReason());
        }
    }
}
